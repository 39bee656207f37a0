/* (C)2026 */
package com.ammann.fedstats.lifecycle;

import com.ammann.fedstats.dto.StatisticsPayload;
import com.ammann.fedstats.enumeration.FailureKind;
import com.ammann.fedstats.enumeration.ReadinessStatus;
import com.ammann.fedstats.enumeration.RoundStage;
import com.ammann.fedstats.exception.ArtifactStoreException;
import com.ammann.fedstats.exception.RoundFailureException;
import com.ammann.fedstats.model.StageOutcome;
import com.ammann.fedstats.store.ArtifactKey;
import com.ammann.fedstats.store.ArtifactStore;
import com.ammann.fedstats.store.PayloadCodec;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * State machine driving one round for one participant, or the aggregation of one round for
 * the coordinator.
 *
 * <p>Participant: INITIAL, DATA_READY, VALIDATED, TRAINED, PUBLISHED.
 * Coordinator: INITIAL, COLLECTED, PUBLISHED. Any stage may end in FAILED.
 *
 * <p>Stage methods never throw for round failures. Every exception raised by the task or the
 * store is logged and converted into a failed {@link StageOutcome} carrying a
 * {@link FailureKind}. Calling a stage out of order is a programming error and throws
 * {@link IllegalStateException}.
 *
 * @param <L> local payload type
 * @param <G> global payload type
 */
public class RoundLifecycleController<L extends StatisticsPayload, G extends StatisticsPayload> {

    private static final Logger LOG = Logger.getLogger(RoundLifecycleController.class);

    private final RoundContext context;
    private final FederatedTask<L, G> task;
    private final ArtifactStore store;

    private RoundStage stage = RoundStage.INITIAL;
    private L localPayload;

    public RoundLifecycleController(RoundContext context, FederatedTask<L, G> task, ArtifactStore store) {
        this.context = context;
        this.task = task;
        this.store = store;
    }

    /**
     * Creates a controller for a task whose payload types are only known at runtime.
     */
    public static <L extends StatisticsPayload, G extends StatisticsPayload> RoundLifecycleController<L, G> of(
            RoundContext context, FederatedTask<L, G> task, ArtifactStore store) {
        return new RoundLifecycleController<>(context, task, store);
    }

    public RoundStage getStage() {
        return stage;
    }

    /**
     * Runs every participant stage in order, stopping at the first failure.
     */
    public StageOutcome runRound() {
        StageOutcome outcome = prepareData();
        if (outcome.success()) {
            outcome = validate();
        }
        if (outcome.success()) {
            outcome = training();
        }
        return outcome;
    }

    public StageOutcome prepareData() {
        requireStage(RoundStage.INITIAL, "prepare data");
        requireParticipant();
        return runStage("prepare data", FailureKind.DATA_UNAVAILABLE, () -> {
            task.prepareData(context);
            return RoundStage.DATA_READY;
        });
    }

    public StageOutcome validate() {
        requireStage(RoundStage.DATA_READY, "validate");
        return runStage("validate", FailureKind.ARTIFACT_UNAVAILABLE, () -> {
            task.validate(context);
            return RoundStage.VALIDATED;
        });
    }

    /**
     * Fits the local model and publishes its payload under this round's key.
     */
    public StageOutcome training() {
        requireStage(RoundStage.VALIDATED, "training");
        StageOutcome fitted = runStage("training", FailureKind.FIT_FAILURE, () -> {
            L payload = task.training(context);
            if (payload == null || !payload.isFinite()) {
                throw RoundFailureException.fitFailure("Local fit produced non-finite statistics", null);
            }
            localPayload = payload;
            return RoundStage.TRAINED;
        });
        if (!fitted.success()) {
            return fitted;
        }
        return runStage("publish", FailureKind.PUBLISH_FAILURE, () -> {
            if (store.isClosed(context.runId(), context.round())
                    || store.read(ArtifactKey.global(context.runId(), context.round())).isPresent()) {
                throw new RoundFailureException(FailureKind.PUBLISH_FAILURE,
                        "Round " + context.round() + " is closed, late payload not published");
            }
            ArtifactKey key = ArtifactKey.local(context.runId(), context.round(), context.participant());
            store.write(key, PayloadCodec.encode(localPayload));
            LOG.infof("Published local payload %s (sample size %d)", key, localPayload.sampleSize());
            return RoundStage.PUBLISHED;
        });
    }

    /**
     * Coordinator stage: aggregates the round once the readiness gate allows it, publishes
     * the global payload and closes the round.
     * <p>
     * A NOT_READY round leaves the controller in INITIAL so the call can be repeated.
     *
     * @param gate     readiness decision for the round
     * @param deadline instant at which the round expires, or null for none
     */
    public StageOutcome doAggregate(RoundReadinessGate gate, Instant deadline) {
        requireStage(RoundStage.INITIAL, "aggregate");
        ReadinessStatus readiness;
        try {
            readiness = gate.evaluate(context.runId(), context.round(), deadline);
        } catch (RuntimeException e) {
            return fail("collect", FailureKind.ARTIFACT_UNAVAILABLE, e);
        }

        switch (readiness) {
            case NOT_READY -> {
                LOG.infof("%s is not ready for aggregation yet", context);
                return StageOutcome.notReady(stage, "Waiting for local payloads of round " + context.round());
            }
            case EMPTY -> {
                return fail("collect", FailureKind.AGGREGATION_INPUT_MISSING,
                        RoundFailureException.inputMissing("No local payloads found for round " + context.round()));
            }
            case QUORUM_NOT_MET -> {
                return fail("collect", FailureKind.QUORUM_NOT_MET, new RoundFailureException(
                        FailureKind.QUORUM_NOT_MET, String.format(
                                "Round %s ended below the minimum quorum of %d",
                                context.round(), gate.getPolicy().minQuorum())));
            }
            case READY -> LOG.debugf("%s is ready for aggregation", context);
        }

        List<L> payloads = new ArrayList<>();
        StageOutcome collected = runStage("collect", FailureKind.ARTIFACT_UNAVAILABLE, () -> {
            for (String blob : store.listLocal(context.runId(), context.round())) {
                payloads.addAll(PayloadCodec.decodeAll(blob, task.localPayloadType()));
            }
            if (payloads.isEmpty()) {
                throw RoundFailureException.inputMissing("No local payloads found for round " + context.round());
            }
            LOG.debugf("Collected %d local payloads for %s", payloads.size(), context);
            return RoundStage.COLLECTED;
        });
        if (!collected.success()) {
            return collected;
        }

        return runStage("aggregate", FailureKind.AGGREGATION_INPUT_MISSING, () -> {
            G global = task.aggregate(payloads);
            if (global == null || !global.isFinite()) {
                throw RoundFailureException.inputMissing("Aggregation produced non-finite statistics");
            }
            ArtifactKey key = ArtifactKey.global(context.runId(), context.round());
            try {
                store.write(key, PayloadCodec.encode(global));
            } catch (ArtifactStoreException e) {
                throw new RoundFailureException(FailureKind.PUBLISH_FAILURE, e.getMessage(), e);
            }
            LOG.infof("Published global payload %s from %d sites (sample size %d)",
                    key, payloads.size(), global.sampleSize());
            closeAfterPublish();
            return RoundStage.PUBLISHED;
        });
    }

    // The published global already rejects late payloads, so a failed marker write only warns.
    private void closeAfterPublish() {
        try {
            store.close(context.runId(), context.round());
        } catch (ArtifactStoreException e) {
            LOG.warnf("%s: global payload published but the round could not be closed: %s",
                    context, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface Stage {
        RoundStage run();
    }

    private StageOutcome runStage(String name, FailureKind defaultKind, Stage body) {
        try {
            stage = body.run();
            LOG.debugf("%s: %s completed, stage %s", context, name, stage);
            return StageOutcome.ok(stage);
        } catch (RoundFailureException e) {
            return fail(name, e.getKind(), e);
        } catch (RuntimeException e) {
            return fail(name, defaultKind, e);
        }
    }

    private StageOutcome fail(String name, FailureKind kind, RuntimeException e) {
        stage = RoundStage.FAILED;
        if (kind == FailureKind.FIT_FAILURE) {
            LOG.errorf(e, "%s: %s failed (%s): %s", context, name, kind, e.getMessage());
        } else {
            LOG.errorf("%s: %s failed (%s): %s", context, name, kind, e.getMessage());
        }
        return StageOutcome.failed(kind, e.getMessage());
    }

    private void requireStage(RoundStage expected, String action) {
        if (stage != expected) {
            throw new IllegalStateException(String.format(
                    "Cannot %s for %s in stage %s, expected %s", action, context, stage, expected));
        }
    }

    private void requireParticipant() {
        if (context.participant() == null) {
            throw new IllegalStateException("Participant stages need a participant id: " + context);
        }
    }
}
