/* (C)2026 */
package com.ammann.fedstats.fit;

/**
 * Sequential minimal optimization for the epsilon-insensitive support vector regression dual.
 * <p>
 * The problem is expressed over {@code 2l} variables: index {@code i < l} holds alpha_i with
 * label +1, index {@code i + l} holds alpha*_i with label -1. The solver minimizes
 * {@code 0.5 a'Qa + p'a} subject to {@code 0 <= a <= C} and {@code y'a = 0}, selecting working
 * pairs by second-order gain and stopping once the maximal KKT violation drops below the
 * tolerance.
 */
final class EpsilonSvrSolver {

    private static final double TAU = 1e-12;

    /**
     * Dual solution.
     *
     * @param coef       alpha_i - alpha*_i per training row
     * @param intercept  bias term of the decision function
     * @param iterations SMO steps taken
     * @param converged  whether the KKT tolerance was reached before the iteration cap
     */
    record Solution(double[] coef, double intercept, int iterations, boolean converged) {}

    private final double[][] kernel;
    private final int l;
    private final double c;
    private final double tolerance;
    private final int maxIterations;

    private final double[] alpha;
    private final double[] gradient;
    private final byte[] label;

    /**
     * @param kernel    precomputed symmetric kernel matrix of the training rows
     * @param target    training outcomes
     * @param c         box constraint
     * @param epsilon   tube half-width
     * @param tolerance stopping tolerance on the KKT violation
     * @param maxIter   iteration cap
     * @param seedCoef  optional feasible starting point as alpha - alpha* per row, or null
     */
    EpsilonSvrSolver(double[][] kernel, double[] target, double c, double epsilon,
            double tolerance, int maxIter, double[] seedCoef) {
        this.kernel = kernel;
        this.l = target.length;
        this.c = c;
        this.tolerance = tolerance;
        this.maxIterations = maxIter;
        this.alpha = new double[2 * l];
        this.gradient = new double[2 * l];
        this.label = new byte[2 * l];

        for (int i = 0; i < l; i++) {
            label[i] = 1;
            label[i + l] = -1;
            gradient[i] = epsilon - target[i];
            gradient[i + l] = epsilon + target[i];
        }

        if (seedCoef != null) {
            for (int i = 0; i < l; i++) {
                alpha[i] = Math.min(c, Math.max(0.0, seedCoef[i]));
                alpha[i + l] = Math.min(c, Math.max(0.0, -seedCoef[i]));
            }
            for (int t = 0; t < 2 * l; t++) {
                int row = t % l;
                double sum = 0.0;
                for (int m = 0; m < l; m++) {
                    sum += kernel[row][m] * (alpha[m] - alpha[m + l]);
                }
                gradient[t] += label[t] * sum;
            }
        }
    }

    Solution solve() {
        int iteration = 0;
        boolean converged = false;
        while (iteration < maxIterations) {
            int[] pair = selectWorkingSet();
            if (pair == null) {
                converged = true;
                break;
            }
            update(pair[0], pair[1]);
            iteration++;
        }

        double[] coef = new double[l];
        for (int i = 0; i < l; i++) {
            coef[i] = alpha[i] - alpha[i + l];
        }
        return new Solution(coef, -computeRho(), iteration, converged);
    }

    private double q(int s, int t) {
        return label[s] * label[t] * kernel[s % l][t % l];
    }

    private boolean isUpperBound(int t) {
        return alpha[t] >= c;
    }

    private boolean isLowerBound(int t) {
        return alpha[t] <= 0;
    }

    /**
     * Returns the maximal-violating pair with second-order gain, or null when optimal.
     */
    private int[] selectWorkingSet() {
        double gMax = Double.NEGATIVE_INFINITY;
        double gMax2 = Double.NEGATIVE_INFINITY;
        int i = -1;
        for (int t = 0; t < 2 * l; t++) {
            if (label[t] == 1) {
                if (!isUpperBound(t) && -gradient[t] >= gMax) {
                    gMax = -gradient[t];
                    i = t;
                }
            } else if (!isLowerBound(t) && gradient[t] >= gMax) {
                gMax = gradient[t];
                i = t;
            }
        }
        if (i == -1) {
            return null;
        }

        int j = -1;
        double objectiveMin = Double.POSITIVE_INFINITY;
        double kii = kernel[i % l][i % l];
        for (int t = 0; t < 2 * l; t++) {
            double gradDiff;
            if (label[t] == 1) {
                if (isLowerBound(t)) {
                    continue;
                }
                gMax2 = Math.max(gMax2, gradient[t]);
                gradDiff = gMax + gradient[t];
            } else {
                if (isUpperBound(t)) {
                    continue;
                }
                gMax2 = Math.max(gMax2, -gradient[t]);
                gradDiff = gMax - gradient[t];
            }
            if (gradDiff > 0) {
                double quad = kii + kernel[t % l][t % l] - 2.0 * kernel[i % l][t % l];
                double objective = -(gradDiff * gradDiff) / (quad > 0 ? quad : TAU);
                if (objective <= objectiveMin) {
                    objectiveMin = objective;
                    j = t;
                }
            }
        }
        if (gMax + gMax2 < tolerance || j == -1) {
            return null;
        }
        return new int[] {i, j};
    }

    private void update(int i, int j) {
        double oldI = alpha[i];
        double oldJ = alpha[j];
        double qij = q(i, j);
        double qii = q(i, i);
        double qjj = q(j, j);

        if (label[i] != label[j]) {
            double quad = qii + qjj + 2.0 * qij;
            if (quad <= 0) {
                quad = TAU;
            }
            double delta = (-gradient[i] - gradient[j]) / quad;
            double diff = alpha[i] - alpha[j];
            alpha[i] += delta;
            alpha[j] += delta;
            if (diff > 0) {
                if (alpha[j] < 0) {
                    alpha[j] = 0;
                    alpha[i] = diff;
                }
            } else if (alpha[i] < 0) {
                alpha[i] = 0;
                alpha[j] = -diff;
            }
            if (diff > 0) {
                if (alpha[i] > c) {
                    alpha[i] = c;
                    alpha[j] = c - diff;
                }
            } else if (alpha[j] > c) {
                alpha[j] = c;
                alpha[i] = c + diff;
            }
        } else {
            double quad = qii + qjj - 2.0 * qij;
            if (quad <= 0) {
                quad = TAU;
            }
            double delta = (gradient[i] - gradient[j]) / quad;
            double sum = alpha[i] + alpha[j];
            alpha[i] -= delta;
            alpha[j] += delta;
            if (sum > c) {
                if (alpha[i] > c) {
                    alpha[i] = c;
                    alpha[j] = sum - c;
                }
            } else if (alpha[j] < 0) {
                alpha[j] = 0;
                alpha[i] = sum;
            }
            if (sum > c) {
                if (alpha[j] > c) {
                    alpha[j] = c;
                    alpha[i] = sum - c;
                }
            } else if (alpha[i] < 0) {
                alpha[i] = 0;
                alpha[j] = sum;
            }
        }

        double deltaI = alpha[i] - oldI;
        double deltaJ = alpha[j] - oldJ;
        for (int t = 0; t < 2 * l; t++) {
            gradient[t] += q(i, t) * deltaI + q(j, t) * deltaJ;
        }
    }

    private double computeRho() {
        double upper = Double.POSITIVE_INFINITY;
        double lower = Double.NEGATIVE_INFINITY;
        double freeSum = 0.0;
        int free = 0;
        for (int t = 0; t < 2 * l; t++) {
            double yg = label[t] * gradient[t];
            if (isUpperBound(t)) {
                if (label[t] == -1) {
                    upper = Math.min(upper, yg);
                } else {
                    lower = Math.max(lower, yg);
                }
            } else if (isLowerBound(t)) {
                if (label[t] == 1) {
                    upper = Math.min(upper, yg);
                } else {
                    lower = Math.max(lower, yg);
                }
            } else {
                free++;
                freeSum += yg;
            }
        }
        return free > 0 ? freeSum / free : (upper + lower) / 2.0;
    }
}
