/* (C)2026 */
package com.ammann.fedstats.dto;

/**
 * Common view of every statistics blob exchanged through the artifact store.
 */
public interface StatisticsPayload {

    /** Rows that contributed to the statistics. */
    int sampleSize();

    /** Whether every numeric field is a finite real number. */
    boolean isFinite();

    static boolean allFinite(double... values) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    static boolean allFinite(double[][] rows) {
        if (rows == null) {
            return false;
        }
        for (double[] row : rows) {
            if (row == null || !allFinite(row)) {
                return false;
            }
        }
        return true;
    }
}
