/* (C)2026 */
package com.ammann.fedstats.service;

import com.ammann.fedstats.dto.RunDescriptorDTO;
import com.ammann.fedstats.exception.ArtifactStoreException;
import com.ammann.fedstats.exception.RunNotFoundException;
import com.ammann.fedstats.exception.ValidationException;
import com.ammann.fedstats.lifecycle.RoundContext;
import com.ammann.fedstats.model.KernelHyperparameters;
import com.ammann.fedstats.model.RoundReference;
import com.ammann.fedstats.model.Run;
import com.ammann.fedstats.store.ArtifactStore;
import com.ammann.fedstats.store.PayloadCodec;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Submission and lookup of runs. A run descriptor is stored once and never changes afterwards.
 */
@ApplicationScoped
public class RunRegistryService {

    private static final Logger LOG = Logger.getLogger(RunRegistryService.class);

    @Inject ArtifactStore store;

    @ConfigProperty(name = "federation.kernel.c", defaultValue = "1.0")
    double kernelC = KernelHyperparameters.DEFAULT_C;

    @ConfigProperty(name = "federation.kernel.epsilon", defaultValue = "0.1")
    double kernelEpsilon = KernelHyperparameters.DEFAULT_EPSILON;

    @ConfigProperty(name = "federation.kernel.tolerance", defaultValue = "0.001")
    double kernelTolerance = KernelHyperparameters.DEFAULT_TOLERANCE;

    @ConfigProperty(name = "federation.kernel.max-iterations", defaultValue = "100000")
    int kernelMaxIterations = KernelHyperparameters.DEFAULT_MAX_ITERATIONS;

    KernelHyperparameters kernelDefaults() {
        return new KernelHyperparameters(kernelC, kernelEpsilon, null, kernelTolerance, kernelMaxIterations);
    }

    /**
     * Validates and stores a new run.
     *
     * @throws ValidationException if the descriptor is invalid or the run id was already submitted
     */
    public Run submit(RunDescriptorDTO descriptor) {
        if (descriptor == null) {
            throw ValidationException.missingField("run");
        }
        Run run = descriptor.toRun(kernelDefaults());
        if (store.readRun(run.runId()).isPresent()) {
            throw ValidationException.invalidParameter("run_id", run.runId(), "a run id that was not submitted before");
        }
        try {
            store.writeRun(run.runId(), PayloadCodec.encode(RunDescriptorDTO.from(run)));
        } catch (ArtifactStoreException e) {
            if (store.readRun(run.runId()).isPresent()) {
                throw ValidationException.invalidParameter(
                        "run_id", run.runId(), "a run id that was not submitted before");
            }
            throw e;
        }
        LOG.infof("Submitted run %s (project %s, batch %s) with %d tasks",
                run.runId(), run.projectId(), run.batchId(), run.tasks().size());
        return run;
    }

    /**
     * @throws RunNotFoundException if the run was never submitted
     */
    public Run find(String runId) {
        if (runId == null || !runId.matches("[A-Za-z0-9._-]+")) {
            throw new RunNotFoundException(runId);
        }
        String blob = store.readRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        return PayloadCodec.decodeSingle(blob, RunDescriptorDTO.class).toRun(kernelDefaults());
    }

    /**
     * Resolves a round of a submitted run.
     *
     * @param participant site id, or null for the coordinator
     * @throws RunNotFoundException if the run or task sequence does not exist
     * @throws ValidationException  if the round is outside the task's rounds or the participant id is invalid
     */
    public RoundContext resolve(String runId, int sequence, int round, String participant) {
        Run run = find(runId);
        RoundReference ref;
        try {
            ref = new RoundReference(sequence, round);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        run.task(sequence);
        if (!run.contains(ref)) {
            throw ValidationException.invalidParameter("round", round,
                    "a round below total_round = " + run.task(sequence).totalRound());
        }
        if (participant != null && !participant.matches("[A-Za-z0-9._-]+")) {
            throw ValidationException.invalidParameter("participant", participant, "letters, digits, '.', '_' or '-'");
        }
        return new RoundContext(run, ref, participant);
    }
}
