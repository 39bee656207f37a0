/* (C)2026 */
package com.ammann.fedstats.support;

import com.ammann.fedstats.dto.KernelStatisticsDTO;
import com.ammann.fedstats.dto.LinearLocalStatisticsDTO;
import com.ammann.fedstats.dto.RunDescriptorDTO;
import com.ammann.fedstats.model.Dataset;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

public final class TestStatistics {

    private TestStatistics() {}

    /**
     * Linear payload with one coefficient per entry of {@code coef}; model fit fields are
     * filled with simple consistent values.
     */
    public static LinearLocalStatisticsDTO linearPayload(int sampleSize, double[] coef, double[] stdErr) {
        return linearPayload(sampleSize, coef, stdErr, 10.0, 20.0, coef.length - 1, sampleSize - coef.length, 0.2);
    }

    public static LinearLocalStatisticsDTO linearPayload(
            int sampleSize, double[] coef, double[] stdErr, double ssModel, double ssResidual,
            double dfModel, double dfResidual, double partialEta) {
        int k = coef.length;
        double[] t = new double[k];
        double[] p = new double[k];
        double[] lower = new double[k];
        double[] upper = new double[k];
        for (int i = 0; i < k; i++) {
            t[i] = stdErr[i] > 0 ? coef[i] / stdErr[i] : 0.0;
            p[i] = 0.5;
            lower[i] = coef[i] - 2 * stdErr[i];
            upper[i] = coef[i] + 2 * stdErr[i];
        }
        double ssTotal = ssModel + ssResidual;
        double r2 = ssModel / ssTotal;
        return new LinearLocalStatisticsDTO(sampleSize, coef, stdErr, t, p, lower, upper,
                r2, r2 - 0.01, 3.0, 0.05, ssModel, ssResidual, ssTotal, dfModel, dfResidual,
                partialEta, Math.min(1, k - 1));
    }

    public static KernelStatisticsDTO kernelPayload(int sampleSize, double[] dual, double intercept) {
        return new KernelStatisticsDTO(sampleSize, new double[][] {dual}, intercept,
                0.25, 0.5, 0.4, 0.6, null, null);
    }

    /**
     * Two-group design with one covariate: y = 1 + 2 g + 0.5 x + noise.
     */
    public static Dataset linearDataset(int n, long seed) {
        Random random = new Random(seed);
        double[][] x = new double[n][];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            double group = i % 2;
            double covariate = random.nextGaussian();
            x[i] = new double[] {group, covariate};
            y[i] = 1.0 + 2.0 * group + 0.5 * covariate + 0.3 * random.nextGaussian();
        }
        return new Dataset(x, y);
    }

    /**
     * One feature on [0, 6], outcome sin(x).
     */
    public static Dataset sineDataset(int n) {
        double[][] x = new double[n][];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            double value = 6.0 * i / (n - 1);
            x[i] = new double[] {value};
            y[i] = Math.sin(value);
        }
        return new Dataset(x, y);
    }

    public static void writeCsv(Path file, Dataset dataset, String header) throws IOException {
        Files.createDirectories(file.getParent());
        List<String> lines = new ArrayList<>();
        if (header != null) {
            lines.add(header);
        }
        double[][] x = dataset.features();
        double[] y = dataset.outcome();
        for (int i = 0; i < y.length; i++) {
            StringBuilder line = new StringBuilder();
            for (double value : x[i]) {
                line.append(value).append(',');
            }
            line.append(y[i]);
            lines.add(line.toString());
        }
        Files.write(file, lines);
    }

    public static RunDescriptorDTO runDescriptor(String runId, String modelKind, int totalRound) {
        return new RunDescriptorDTO(runId, "project-1", "batch-1", totalRound,
                List.of(new RunDescriptorDTO.TaskDescriptorDTO(
                        modelKind, Map.of("n_group_columns", 1, "total_round", totalRound))));
    }
}
