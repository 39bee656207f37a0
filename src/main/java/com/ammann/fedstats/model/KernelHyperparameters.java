/* (C)2026 */
package com.ammann.fedstats.model;

/**
 * Hyperparameters of the RBF-kernel support vector regressor.
 *
 * @param c             regularization bound on each dual variable
 * @param epsilon       half-width of the insensitive tube
 * @param gamma         RBF width; {@code null} selects 1 / (n_features * Var(X))
 * @param tolerance     KKT violation tolerance that stops the solver
 * @param maxIterations solver iteration cap
 */
public record KernelHyperparameters(
        double c,
        double epsilon,
        Double gamma,
        double tolerance,
        int maxIterations) {

    public static final double DEFAULT_C = 1.0;
    public static final double DEFAULT_EPSILON = 0.1;
    public static final double DEFAULT_TOLERANCE = 1e-3;
    public static final int DEFAULT_MAX_ITERATIONS = 100_000;

    public KernelHyperparameters {
        if (!(c > 0)) {
            throw new IllegalArgumentException("C must be positive, got " + c);
        }
        if (!(epsilon >= 0)) {
            throw new IllegalArgumentException("Epsilon must be non-negative, got " + epsilon);
        }
        if (gamma != null && !(gamma > 0)) {
            throw new IllegalArgumentException("Gamma must be positive, got " + gamma);
        }
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Tolerance must be positive, got " + tolerance);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("Max iterations must be positive, got " + maxIterations);
        }
    }

    public static KernelHyperparameters defaults() {
        return new KernelHyperparameters(
                DEFAULT_C, DEFAULT_EPSILON, null, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
    }
}
