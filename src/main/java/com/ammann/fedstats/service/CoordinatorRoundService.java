/* (C)2026 */
package com.ammann.fedstats.service;

import com.ammann.fedstats.dto.RoundOutcomeDTO;
import com.ammann.fedstats.enumeration.RoundStage;
import com.ammann.fedstats.lifecycle.RoundContext;
import com.ammann.fedstats.lifecycle.RoundLifecycleController;
import com.ammann.fedstats.lifecycle.RoundReadinessGate;
import com.ammann.fedstats.model.QuorumPolicy;
import com.ammann.fedstats.model.RoundReference;
import com.ammann.fedstats.model.StageOutcome;
import com.ammann.fedstats.store.ArtifactKey;
import com.ammann.fedstats.store.ArtifactStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Coordinator side of the round protocol.
 *
 * <p>A round is registered as pending the first time aggregation is requested; its deadline is
 * that instant plus {@code federation.round.max-wait}. While the readiness gate reports
 * NOT_READY the round stays pending and the request can be repeated, by a client or by the
 * watchdog. Once the round is aggregated or has failed it leaves the registry.
 */
@ApplicationScoped
public class CoordinatorRoundService {

    private static final Logger LOG = Logger.getLogger(CoordinatorRoundService.class);

    /** Round key in the pending registry. */
    record PendingRound(String runId, RoundReference round) {}

    @Inject RunRegistryService runRegistry;

    @Inject FederatedTaskFactory taskFactory;

    @Inject ArtifactStore store;

    @Inject MeterRegistry meterRegistry;

    @ConfigProperty(name = "federation.round.expected-participants", defaultValue = "0")
    int expectedParticipants = 0;

    @ConfigProperty(name = "federation.round.min-quorum", defaultValue = "1")
    int minQuorum = 1;

    @ConfigProperty(name = "federation.round.max-wait", defaultValue = "30m")
    Duration maxWait = Duration.ofMinutes(30);

    @ConfigProperty(name = "federation.round.poll-interval", defaultValue = "1s")
    Duration pollInterval = Duration.ofSeconds(1);

    Clock clock = Clock.systemUTC();

    private final Map<PendingRound, Instant> pendingRounds = new ConcurrentHashMap<>();

    private Counter aggregationCounter;
    private Counter aggregationFailureCounter;

    void initMetrics() {
        if (meterRegistry != null && aggregationCounter == null) {
            aggregationCounter = Counter.builder("federation_aggregations_total")
                    .description("Global payloads published by the coordinator")
                    .register(meterRegistry);
            aggregationFailureCounter = Counter.builder("federation_aggregation_failures_total")
                    .description("Coordinator rounds that failed to aggregate")
                    .register(meterRegistry);
        }
    }

    QuorumPolicy policy() {
        return new QuorumPolicy(expectedParticipants, minQuorum, maxWait, pollInterval);
    }

    /**
     * Aggregates a round if the readiness gate allows it.
     *
     * @return PUBLISHED on success, a NOT_READY outcome while waiting, or a failed outcome
     */
    public synchronized RoundOutcomeDTO aggregate(String runId, int sequence, int round) {
        initMetrics();
        RoundContext context = runRegistry.resolve(runId, sequence, round, null);
        PendingRound pending = new PendingRound(runId, context.round());

        if (store.read(ArtifactKey.global(runId, context.round())).isPresent()) {
            pendingRounds.remove(pending);
            LOG.debugf("Global payload of %s already published", context);
            return RoundOutcomeDTO.from(runId, context.round(), null,
                    new StageOutcome(true, RoundStage.PUBLISHED, null, "Global payload already published"));
        }

        Instant deadline = pendingRounds.computeIfAbsent(pending, key -> clock.instant().plus(maxWait));
        RoundReadinessGate gate = new RoundReadinessGate(store, policy(), clock);
        RoundLifecycleController<?, ?> controller = RoundLifecycleController.of(
                context, taskFactory.create(context.specification()), store);
        StageOutcome outcome = controller.doAggregate(gate, deadline);

        if (outcome.isNotReady()) {
            LOG.debugf("%s pending until %s", context, deadline);
        } else {
            pendingRounds.remove(pending);
            if (outcome.success()) {
                if (aggregationCounter != null) {
                    aggregationCounter.increment();
                }
            } else {
                if (aggregationFailureCounter != null) {
                    aggregationFailureCounter.increment();
                }
                LOG.warnf("Aggregation of %s failed with %s: %s", context, outcome.failure(), outcome.message());
            }
        }
        return RoundOutcomeDTO.from(runId, context.round(), null, outcome);
    }

    /**
     * Blocks until the round is ready or its deadline passes, then aggregates.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public RoundOutcomeDTO awaitAndAggregate(String runId, int sequence, int round) throws InterruptedException {
        RoundContext context = runRegistry.resolve(runId, sequence, round, null);
        Instant deadline = pendingRounds.computeIfAbsent(
                new PendingRound(runId, context.round()), key -> clock.instant().plus(maxWait));
        LOG.infof("Waiting for %s until %s", context, deadline);
        new RoundReadinessGate(store, policy(), clock).await(runId, context.round(), deadline);
        return aggregate(runId, sequence, round);
    }

    /**
     * Publishes the round-closure signal: no further local payloads are expected.
     */
    public void closeRound(String runId, int sequence, int round) {
        RoundContext context = runRegistry.resolve(runId, sequence, round, null);
        store.close(runId, context.round());
    }

    public Optional<String> findGlobal(String runId, int sequence, int round) {
        RoundContext context = runRegistry.resolve(runId, sequence, round, null);
        return store.read(ArtifactKey.global(runId, context.round()));
    }

    /**
     * Re-evaluates every pending round once.
     *
     * @return number of rounds that left the pending registry
     */
    public int processPendingRounds() {
        List<PendingRound> snapshot = new ArrayList<>(pendingRounds.keySet());
        int resolved = 0;
        for (PendingRound pending : snapshot) {
            try {
                RoundOutcomeDTO outcome = aggregate(
                        pending.runId(), pending.round().sequence(), pending.round().round());
                if (!pendingRounds.containsKey(pending)) {
                    resolved++;
                    LOG.infof("Watchdog resolved round %s of run %s: success=%b, failure=%s",
                            pending.round(), pending.runId(), outcome.success(), outcome.failure());
                }
            } catch (RuntimeException e) {
                pendingRounds.remove(pending);
                resolved++;
                LOG.errorf(e, "Dropping pending round %s of run %s", pending.round(), pending.runId());
            }
        }
        return resolved;
    }

    int pendingCount() {
        return pendingRounds.size();
    }

    Optional<Instant> deadlineOf(String runId, RoundReference round) {
        return Optional.ofNullable(pendingRounds.get(new PendingRound(runId, round)));
    }
}
