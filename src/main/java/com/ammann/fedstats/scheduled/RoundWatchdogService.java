/* (C)2026 */
package com.ammann.fedstats.scheduled;

import com.ammann.fedstats.service.CoordinatorRoundService;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Watchdog for coordinator rounds that are waiting for local payloads.
 * <p>
 * Every pending round is re-evaluated on each tick. A round whose participants have all
 * published, or that was closed, is aggregated. A round past its deadline is aggregated when
 * the minimum quorum published and failed otherwise.
 */
@ApplicationScoped
public class RoundWatchdogService {

    private static final Logger LOG = Logger.getLogger(RoundWatchdogService.class);

    @Inject CoordinatorRoundService coordinator;

    @Scheduled(
            every = "{federation.round.watchdog-interval}",
            identity = "round-watchdog",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void checkPendingRounds() {
        int resolved = coordinator.processPendingRounds();
        if (resolved > 0) {
            LOG.infof("Watchdog: resolved %d pending round(s)", resolved);
        } else {
            LOG.debug("Watchdog: no pending round resolved");
        }
    }
}
