/* (C)2026 */
package com.ammann.fedstats.aggregation;

import com.ammann.fedstats.dto.KernelStatisticsDTO;
import com.ammann.fedstats.dto.RegressionScores;
import com.ammann.fedstats.exception.RoundFailureException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Averages site SVR solutions weighted by sample size:
 * {@code pooled = sum(param_i * n_i) / sum(n_i)} for every dual coefficient and the intercept.
 * <p>
 * Held-out metrics are pooled the same way. Payloads without a dual solution are skipped.
 */
public class KernelParameterAveragingAggregator {

    private static final Logger LOG = Logger.getLogger(KernelParameterAveragingAggregator.class);

    private static final Comparator<double[][]> ROWS_ORDER = (a, b) -> {
        int rows = Integer.compare(a.length, b.length);
        if (rows != 0) {
            return rows;
        }
        for (int i = 0; i < a.length; i++) {
            int row = Arrays.compare(a[i], b[i]);
            if (row != 0) {
                return row;
            }
        }
        return 0;
    };

    static final Comparator<KernelStatisticsDTO> CANONICAL_ORDER =
            Comparator.comparingInt(KernelStatisticsDTO::sampleSize)
                    .thenComparingDouble(KernelStatisticsDTO::intercept)
                    .thenComparing(KernelStatisticsDTO::dualCoef, ROWS_ORDER)
                    .thenComparingDouble(KernelStatisticsDTO::metricMse);

    /**
     * Aggregates the local payloads of one round.
     *
     * @throws RoundFailureException AGGREGATION_INPUT_MISSING when no payload carries a usable
     *                               dual solution, AGGREGATION_SHAPE_MISMATCH when dual shapes differ
     */
    public KernelStatisticsDTO aggregate(Collection<KernelStatisticsDTO> payloads) {
        List<KernelStatisticsDTO> sites = new ArrayList<>();
        if (payloads != null) {
            for (KernelStatisticsDTO payload : payloads) {
                if (payload.hasDualSolution() && payload.sampleSize() > 0) {
                    sites.add(payload);
                } else {
                    LOG.warnf("Skipping kernel payload without dual solution (sample size %d)",
                            payload.sampleSize());
                }
            }
        }
        if (sites.isEmpty()) {
            throw RoundFailureException.inputMissing("No kernel payload with a usable dual solution");
        }
        sites.sort(CANONICAL_ORDER);

        double[][] reference = sites.get(0).dualCoef();
        for (KernelStatisticsDTO site : sites) {
            double[][] dual = site.dualCoef();
            if (dual.length != reference.length) {
                throw RoundFailureException.shapeMismatch("dual_coef", shape(reference), shape(dual));
            }
            for (int r = 0; r < dual.length; r++) {
                if (dual[r] == null || dual[r].length != reference[r].length) {
                    throw RoundFailureException.shapeMismatch("dual_coef", shape(reference), shape(dual));
                }
            }
        }

        int n = sites.size();
        int[] weights = new int[n];
        double[] mse = new double[n];
        double[] mae = new double[n];
        double[] r2 = new double[n];
        int total = 0;
        double[][] pooled = new double[reference.length][];
        for (int r = 0; r < reference.length; r++) {
            pooled[r] = new double[reference[r].length];
        }
        double intercept = 0.0;

        for (int s = 0; s < n; s++) {
            KernelStatisticsDTO site = sites.get(s);
            int weight = site.sampleSize();
            weights[s] = weight;
            mse[s] = site.metricMse();
            mae[s] = site.metricMae();
            r2[s] = site.metricR2();
            total += weight;
            intercept += site.intercept() * weight;
            for (int r = 0; r < pooled.length; r++) {
                for (int c = 0; c < pooled[r].length; c++) {
                    pooled[r][c] += site.dualCoef()[r][c] * weight;
                }
            }
        }
        for (double[] row : pooled) {
            for (int c = 0; c < row.length; c++) {
                row[c] /= total;
            }
        }
        intercept /= total;
        RegressionScores scores = RegressionScores.weighted(mse, mae, r2, weights);

        LOG.infof("Aggregated %d kernel payloads, total sample size %d, intercept %.4f",
                n, total, intercept);
        LOG.infof("Weighted held-out MSE = %.4f, R² = %.4f", scores.mse(), scores.r2());

        return new KernelStatisticsDTO(total, pooled, intercept,
                scores.mse(), scores.rmse(), scores.mae(), scores.r2(), total, n);
    }

    private static String shape(double[][] dual) {
        return dual.length + "x" + (dual.length == 0 || dual[0] == null ? 0 : dual[0].length);
    }
}
