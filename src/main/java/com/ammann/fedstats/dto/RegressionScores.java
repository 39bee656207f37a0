/* (C)2026 */
package com.ammann.fedstats.dto;

/**
 * Held-out regression metrics.
 *
 * @param mse  mean squared error
 * @param rmse square root of {@code mse}
 * @param mae  mean absolute error
 * @param r2   coefficient of determination
 */
public record RegressionScores(double mse, double rmse, double mae, double r2) {

    /**
     * Scores predictions against observed values.
     * <p>
     * R² is 1 - SS_res / SS_tot; when the observations have zero variance it is 1 for a
     * perfect prediction and 0 otherwise.
     *
     * @param observed  observed outcomes
     * @param predicted model predictions, same length
     * @return metrics
     * @throws IllegalArgumentException if the arrays are empty or differ in length
     */
    public static RegressionScores of(double[] observed, double[] predicted) {
        if (observed.length == 0 || observed.length != predicted.length) {
            throw new IllegalArgumentException(String.format(
                    "Cannot score %d predictions against %d observations", predicted.length, observed.length));
        }
        int n = observed.length;
        double mean = 0.0;
        for (double value : observed) {
            mean += value;
        }
        mean /= n;

        double ssResidual = 0.0;
        double ssTotal = 0.0;
        double absolute = 0.0;
        for (int i = 0; i < n; i++) {
            double error = observed[i] - predicted[i];
            ssResidual += error * error;
            absolute += Math.abs(error);
            double deviation = observed[i] - mean;
            ssTotal += deviation * deviation;
        }

        double mse = ssResidual / n;
        double r2;
        if (ssTotal > 0) {
            r2 = 1.0 - ssResidual / ssTotal;
        } else {
            r2 = ssResidual == 0.0 ? 1.0 : 0.0;
        }
        return new RegressionScores(mse, Math.sqrt(mse), absolute / n, r2);
    }

    /**
     * Sample-size-weighted combination of several sites' scores. RMSE is recomputed from the
     * pooled MSE so the identity rmse = sqrt(mse) holds.
     */
    public static RegressionScores weighted(double[] mse, double[] mae, double[] r2, int[] weights) {
        double total = 0.0;
        double pooledMse = 0.0;
        double pooledMae = 0.0;
        double pooledR2 = 0.0;
        for (int i = 0; i < weights.length; i++) {
            total += weights[i];
            pooledMse += mse[i] * weights[i];
            pooledMae += mae[i] * weights[i];
            pooledR2 += r2[i] * weights[i];
        }
        if (total <= 0) {
            return new RegressionScores(0.0, 0.0, 0.0, 0.0);
        }
        pooledMse /= total;
        return new RegressionScores(pooledMse, Math.sqrt(pooledMse), pooledMae / total, pooledR2 / total);
    }
}
