/* (C)2026 */
package com.ammann.fedstats.fit;

/**
 * Per-column standardization to zero mean and unit variance.
 * <p>
 * Statistics are estimated once, on the training partition, and applied unchanged to every
 * matrix transformed afterwards. Columns with zero variance keep a scale of 1.
 */
public final class FeatureScaler {

    private final double[] mean;
    private final double[] scale;

    private FeatureScaler(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    /**
     * Estimates column means and population standard deviations.
     */
    public static FeatureScaler fit(double[][] rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot fit a scaler on zero rows");
        }
        int columns = rows[0].length;
        double[] mean = new double[columns];
        double[] scale = new double[columns];
        for (double[] row : rows) {
            for (int j = 0; j < columns; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < columns; j++) {
            mean[j] /= rows.length;
        }
        for (double[] row : rows) {
            for (int j = 0; j < columns; j++) {
                double deviation = row[j] - mean[j];
                scale[j] += deviation * deviation;
            }
        }
        for (int j = 0; j < columns; j++) {
            double std = Math.sqrt(scale[j] / rows.length);
            scale[j] = std > 0 ? std : 1.0;
        }
        return new FeatureScaler(mean, scale);
    }

    public double[][] transform(double[][] rows) {
        double[][] scaled = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != mean.length) {
                throw new IllegalArgumentException(String.format(
                        "Row %d has %d columns, scaler was fitted on %d", i, rows[i].length, mean.length));
            }
            scaled[i] = new double[mean.length];
            for (int j = 0; j < mean.length; j++) {
                scaled[i][j] = (rows[i][j] - mean[j]) / scale[j];
            }
        }
        return scaled;
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[] getScale() {
        return scale.clone();
    }
}
