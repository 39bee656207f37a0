/* (C)2026 */
package com.ammann.fedstats.model;

import com.ammann.fedstats.enumeration.ModelKind;
import com.ammann.fedstats.exception.ValidationException;
import java.util.Map;

/**
 * Per-task model configuration, fixed for the life of the task.
 *
 * @param modelKind     which fitter and aggregation rule the task uses
 * @param nGroupColumns number of leading dummy-coded group columns (linear model)
 * @param totalRound    number of federated rounds for this task
 * @param currentRound  round index recorded at submission
 * @param kernel        kernel hyperparameters (kernel model)
 */
public record ModelSpecification(
        ModelKind modelKind,
        int nGroupColumns,
        int totalRound,
        int currentRound,
        KernelHyperparameters kernel) {

    public static final String N_GROUP_COLUMNS = "n_group_columns";
    public static final String TOTAL_ROUND = "total_round";
    public static final String CURRENT_ROUND = "current_round";
    public static final String KERNEL_C = "c";
    public static final String KERNEL_EPSILON = "epsilon";
    public static final String KERNEL_GAMMA = "gamma";
    public static final String KERNEL_TOLERANCE = "tolerance";
    public static final String KERNEL_MAX_ITERATIONS = "max_iterations";

    public ModelSpecification {
        if (modelKind == null) {
            throw ValidationException.missingField("model_kind");
        }
        if (nGroupColumns < 0) {
            throw ValidationException.invalidParameter(N_GROUP_COLUMNS, nGroupColumns, "a non-negative integer");
        }
        if (totalRound < 1) {
            throw ValidationException.invalidParameter(TOTAL_ROUND, totalRound, "at least 1");
        }
        if (currentRound < 0) {
            throw ValidationException.invalidParameter(CURRENT_ROUND, currentRound, "a non-negative integer");
        }
        if (kernel == null) {
            kernel = KernelHyperparameters.defaults();
        }
    }

    /**
     * Builds a specification from a task's config map.
     * <p>
     * Recognized keys: {@code n_group_columns} (default 1), {@code total_round} (default 1),
     * {@code current_round} (default 0) and the kernel overrides {@code c}, {@code epsilon},
     * {@code gamma}, {@code tolerance}, {@code max_iterations}.
     *
     * @param modelKind      model kind of the task
     * @param config         raw config values, may be null
     * @param kernelDefaults service-wide kernel defaults used for keys the config omits
     * @return validated specification
     */
    public static ModelSpecification fromConfig(
            ModelKind modelKind, Map<String, Object> config, KernelHyperparameters kernelDefaults) {
        Map<String, Object> values = config == null ? Map.of() : config;
        KernelHyperparameters kernel = new KernelHyperparameters(
                doubleValue(values, KERNEL_C, kernelDefaults.c()),
                doubleValue(values, KERNEL_EPSILON, kernelDefaults.epsilon()),
                values.containsKey(KERNEL_GAMMA)
                        ? Double.valueOf(doubleValue(values, KERNEL_GAMMA, 0.0))
                        : kernelDefaults.gamma(),
                doubleValue(values, KERNEL_TOLERANCE, kernelDefaults.tolerance()),
                intValue(values, KERNEL_MAX_ITERATIONS, kernelDefaults.maxIterations()));
        return new ModelSpecification(
                modelKind,
                intValue(values, N_GROUP_COLUMNS, 1),
                intValue(values, TOTAL_ROUND, 1),
                intValue(values, CURRENT_ROUND, 0),
                kernel);
    }

    private static int intValue(Map<String, Object> values, String key, int fallback) {
        Object raw = values.get(key);
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Number number) {
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                throw ValidationException.invalidParameter(key, raw, "an integer");
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw ValidationException.invalidParameter(key, raw, "an integer");
        }
    }

    private static double doubleValue(Map<String, Object> values, String key, double fallback) {
        Object raw = values.get(key);
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw ValidationException.invalidParameter(key, raw, "a number");
        }
    }
}
