/* (C)2026 */
package com.ammann.fedstats.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * A site's local records: a rectangular feature matrix and one outcome per row.
 * <p>
 * Arrays are defensively copied on construction and never exposed for mutation by the
 * fitters, which only read them.
 */
public final class Dataset {

    private final double[][] features;
    private final double[] outcome;
    private final int featureCount;

    public Dataset(double[][] features, double[] outcome) {
        if (features == null || outcome == null) {
            throw new IllegalArgumentException("Features and outcome must not be null");
        }
        if (features.length != outcome.length) {
            throw new IllegalArgumentException(String.format(
                    "Feature rows (%d) and outcome length (%d) differ", features.length, outcome.length));
        }
        this.featureCount = features.length == 0 ? 0 : features[0].length;
        this.features = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            if (features[i].length != featureCount) {
                throw new IllegalArgumentException(String.format(
                        "Row %d has %d features, expected %d", i, features[i].length, featureCount));
            }
            this.features[i] = features[i].clone();
        }
        this.outcome = outcome.clone();
    }

    public int size() {
        return outcome.length;
    }

    public boolean isEmpty() {
        return outcome.length == 0;
    }

    public int featureCount() {
        return featureCount;
    }

    public double[][] features() {
        double[][] copy = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            copy[i] = features[i].clone();
        }
        return copy;
    }

    public double[] outcome() {
        return outcome.clone();
    }

    /**
     * Deterministically partitions the rows into a training and a held-out set.
     * <p>
     * Row order is shuffled with {@code new Random(seed)}; the held-out partition receives
     * {@code ceil(testFraction * n)} rows and the training partition the rest.
     *
     * @param testFraction fraction of rows held out, in (0, 1)
     * @param seed         shuffle seed
     * @return the two partitions
     * @throws IllegalArgumentException if fewer than two rows exist or the fraction is out of range
     */
    public TrainTestSplit split(double testFraction, long seed) {
        if (!(testFraction > 0 && testFraction < 1)) {
            throw new IllegalArgumentException("Test fraction must be in (0, 1), got " + testFraction);
        }
        int n = size();
        int heldOutSize = (int) Math.ceil(testFraction * n);
        int trainSize = n - heldOutSize;
        if (trainSize < 1) {
            throw new IllegalArgumentException(String.format(
                    "Cannot split %d rows with test fraction %.2f", n, testFraction));
        }

        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        Collections.shuffle(order, new Random(seed));

        return new TrainTestSplit(
                subset(order.subList(heldOutSize, n)),
                subset(order.subList(0, heldOutSize)));
    }

    private Dataset subset(List<Integer> rows) {
        double[][] x = new double[rows.size()][];
        double[] y = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            int row = rows.get(i);
            x[i] = features[row];
            y[i] = outcome[row];
        }
        return new Dataset(x, y);
    }
}
