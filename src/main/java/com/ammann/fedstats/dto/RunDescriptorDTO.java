/* (C)2026 */
package com.ammann.fedstats.dto;

import com.ammann.fedstats.enumeration.ModelKind;
import com.ammann.fedstats.exception.ValidationException;
import com.ammann.fedstats.model.KernelHyperparameters;
import com.ammann.fedstats.model.ModelSpecification;
import com.ammann.fedstats.model.Run;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Wire form of a run as submitted by a client and stored as {@code run.json}.
 */
@Schema(description = "Federated run with its ordered task specifications")
public record RunDescriptorDTO(
        @JsonProperty("run_id") String runId,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("total_round") int totalRound,
        @JsonProperty("tasks") List<TaskDescriptorDTO> tasks) {

    /**
     * One task of a run.
     *
     * @param modelKind model kind name, e.g. LINEAR_COVARIATE
     * @param config    model specification options
     */
    public record TaskDescriptorDTO(
            @JsonProperty("model_kind") String modelKind,
            @JsonProperty("config") Map<String, Object> config) {}

    /**
     * Converts the descriptor to the domain run, validating every task.
     *
     * @param kernelDefaults defaults for kernel options a task does not override
     * @return validated run
     * @throws ValidationException if any field is missing or invalid
     */
    public Run toRun(KernelHyperparameters kernelDefaults) {
        if (tasks == null || tasks.isEmpty()) {
            throw ValidationException.missingField("tasks");
        }
        List<ModelSpecification> specifications = new ArrayList<>(tasks.size());
        for (TaskDescriptorDTO task : tasks) {
            ModelKind kind;
            try {
                kind = ModelKind.fromConfig(task.modelKind());
            } catch (IllegalArgumentException e) {
                throw ValidationException.invalidParameter("model_kind", task.modelKind(),
                        "one of LINEAR_COVARIATE, KERNEL_REGRESSION");
            }
            try {
                specifications.add(ModelSpecification.fromConfig(kind, task.config(), kernelDefaults));
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage(), e);
            }
        }
        return new Run(runId, projectId, batchId, specifications, totalRound);
    }

    public static RunDescriptorDTO from(Run run) {
        List<TaskDescriptorDTO> tasks = run.tasks().stream()
                .map(RunDescriptorDTO::describe)
                .toList();
        return new RunDescriptorDTO(run.runId(), run.projectId(), run.batchId(), run.totalRound(), tasks);
    }

    private static TaskDescriptorDTO describe(ModelSpecification specification) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(ModelSpecification.N_GROUP_COLUMNS, specification.nGroupColumns());
        config.put(ModelSpecification.TOTAL_ROUND, specification.totalRound());
        config.put(ModelSpecification.CURRENT_ROUND, specification.currentRound());
        if (specification.modelKind() == ModelKind.KERNEL_REGRESSION) {
            KernelHyperparameters kernel = specification.kernel();
            config.put(ModelSpecification.KERNEL_C, kernel.c());
            config.put(ModelSpecification.KERNEL_EPSILON, kernel.epsilon());
            if (kernel.gamma() != null) {
                config.put(ModelSpecification.KERNEL_GAMMA, kernel.gamma());
            }
            config.put(ModelSpecification.KERNEL_TOLERANCE, kernel.tolerance());
            config.put(ModelSpecification.KERNEL_MAX_ITERATIONS, kernel.maxIterations());
        }
        return new TaskDescriptorDTO(specification.modelKind().name(), config);
    }
}
