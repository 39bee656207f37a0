/* (C)2026 */
package com.ammann.fedstats.service;

import com.ammann.fedstats.dto.RoundOutcomeDTO;
import com.ammann.fedstats.lifecycle.RoundContext;
import com.ammann.fedstats.lifecycle.RoundLifecycleController;
import com.ammann.fedstats.model.StageOutcome;
import com.ammann.fedstats.store.ArtifactStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Executes a site's round: prepare data, validate, train and publish the local payload.
 */
@ApplicationScoped
public class ParticipantRoundService {

    private static final Logger LOG = Logger.getLogger(ParticipantRoundService.class);

    @Inject RunRegistryService runRegistry;

    @Inject FederatedTaskFactory taskFactory;

    @Inject ArtifactStore store;

    @Inject MeterRegistry meterRegistry;

    private Counter publishedCounter;
    private Counter failureCounter;

    void initMetrics() {
        if (meterRegistry != null && publishedCounter == null) {
            publishedCounter = Counter.builder("federation_rounds_published_total")
                    .description("Local payloads published by this site")
                    .register(meterRegistry);
            failureCounter = Counter.builder("federation_round_failures_total")
                    .description("Site rounds that ended in a failed stage")
                    .register(meterRegistry);
        }
    }

    /**
     * Runs one round for a participant.
     *
     * @return the round outcome; failures are reported in the outcome, not thrown
     * @throws com.ammann.fedstats.exception.RunNotFoundException if the run or task does not exist
     * @throws com.ammann.fedstats.exception.ValidationException  if the round or participant is invalid
     */
    public RoundOutcomeDTO runRound(String runId, int sequence, int round, String participant) {
        initMetrics();
        RoundContext context = runRegistry.resolve(runId, sequence, round, participant);
        LOG.infof("Starting %s (%s)", context, context.specification().modelKind());

        RoundLifecycleController<?, ?> controller = RoundLifecycleController.of(
                context, taskFactory.create(context.specification()), store);
        StageOutcome outcome = controller.runRound();

        if (outcome.success()) {
            if (publishedCounter != null) {
                publishedCounter.increment();
            }
            LOG.infof("Finished %s: %s", context, outcome.stage());
        } else {
            if (failureCounter != null) {
                failureCounter.increment();
            }
            LOG.warnf("Finished %s with failure %s: %s", context, outcome.failure(), outcome.message());
        }
        return RoundOutcomeDTO.from(runId, context.round(), participant, outcome);
    }
}
