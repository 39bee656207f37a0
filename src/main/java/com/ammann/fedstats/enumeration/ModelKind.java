/* (C)2026 */
package com.ammann.fedstats.enumeration;

import java.util.Locale;

/**
 * Model kind selected by a task's model specification.
 * <p>
 * Each kind maps to one federated task variant with its own local fitter and aggregation rule.
 */
public enum ModelKind {
    /** OLS with leading group dummies and continuous covariates, pooled by inverse-variance meta-analysis. */
    LINEAR_COVARIATE,
    /** RBF-kernel support vector regression, pooled by sample-size-weighted parameter averaging. */
    KERNEL_REGRESSION;

    /**
     * Resolves a model kind from a configuration value, accepting the enum name in any case
     * and with either dashes or underscores.
     *
     * @param value configured model kind
     * @return matching model kind
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static ModelKind fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Model kind must not be blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return ModelKind.valueOf(normalized);
    }
}
