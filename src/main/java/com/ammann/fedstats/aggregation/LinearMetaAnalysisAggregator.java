/* (C)2026 */
package com.ammann.fedstats.aggregation;

import com.ammann.fedstats.dto.LinearGlobalStatisticsDTO;
import com.ammann.fedstats.dto.LinearLocalStatisticsDTO;
import com.ammann.fedstats.exception.RoundFailureException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.jboss.logging.Logger;

/**
 * Pools site OLS fits by fixed-effect inverse-variance meta-analysis.
 *
 * <p>Per coefficient index:
 *
 * <pre>
 * w_i       = 1 / se_i^2                          (0 if se_i == 0)
 * pooled_b  = sum(b_i * w_i) / sum(w_i)           (mean of b_i if sum(w_i) == 0)
 * pooled_se = sqrt(1 / sum(w_i))                  (0 if sum(w_i) == 0)
 * z         = pooled_b / pooled_se                (0 if pooled_se == 0)
 * p         = 2 * (1 - Phi(|z|))                  (1 if pooled_se == 0)
 * CI        = pooled_b +/- 1.96 * pooled_se
 * </pre>
 *
 * <p>Sums of squares and residual degrees of freedom are summed across sites; the model
 * degrees of freedom must agree. Inputs are sorted into a canonical order first, so the result
 * is bit-for-bit identical for any arrival order.
 */
public class LinearMetaAnalysisAggregator {

    private static final Logger LOG = Logger.getLogger(LinearMetaAnalysisAggregator.class);

    static final double Z_CRITICAL = 1.96;
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private static final Comparator<double[]> VECTOR_ORDER = Arrays::compare;

    static final Comparator<LinearLocalStatisticsDTO> CANONICAL_ORDER =
            Comparator.comparingInt(LinearLocalStatisticsDTO::sampleSize)
                    .thenComparing(LinearLocalStatisticsDTO::coef, VECTOR_ORDER)
                    .thenComparing(LinearLocalStatisticsDTO::stdErr, VECTOR_ORDER)
                    .thenComparingDouble(LinearLocalStatisticsDTO::ssModel)
                    .thenComparingDouble(LinearLocalStatisticsDTO::ssResidual)
                    .thenComparingDouble(LinearLocalStatisticsDTO::dfResidual)
                    .thenComparingDouble(LinearLocalStatisticsDTO::partialEtaSquared);

    /**
     * Aggregates the local payloads of one round.
     *
     * @param payloads local payloads, at least one
     * @return pooled statistics
     * @throws RoundFailureException AGGREGATION_INPUT_MISSING for an empty collection,
     *                               AGGREGATION_SHAPE_MISMATCH when sites disagree on dimensions
     */
    public LinearGlobalStatisticsDTO aggregate(Collection<LinearLocalStatisticsDTO> payloads) {
        if (payloads == null || payloads.isEmpty()) {
            throw RoundFailureException.inputMissing("No local linear payloads to aggregate");
        }
        List<LinearLocalStatisticsDTO> sites = new ArrayList<>(payloads);
        sites.sort(CANONICAL_ORDER);
        validateShapes(sites);

        LinearLocalStatisticsDTO reference = sites.get(0);
        int k = reference.coef().length;

        double[] pooledCoef = new double[k];
        double[] pooledSe = new double[k];
        double[] zValues = new double[k];
        double[] pValues = new double[k];
        double[] lower = new double[k];
        double[] upper = new double[k];

        for (int j = 0; j < k; j++) {
            double weightSum = 0.0;
            double weightedCoefSum = 0.0;
            double coefSum = 0.0;
            for (LinearLocalStatisticsDTO site : sites) {
                double se = site.stdErr()[j];
                double weight = se > 0 ? 1.0 / (se * se) : 0.0;
                weightSum += weight;
                weightedCoefSum += site.coef()[j] * weight;
                coefSum += site.coef()[j];
            }

            pooledCoef[j] = weightSum > 0 ? weightedCoefSum / weightSum : coefSum / sites.size();
            pooledSe[j] = weightSum > 0 ? Math.sqrt(1.0 / weightSum) : 0.0;
            if (pooledSe[j] > 0) {
                zValues[j] = pooledCoef[j] / pooledSe[j];
                pValues[j] = 2.0 * (1.0 - STANDARD_NORMAL.cumulativeProbability(Math.abs(zValues[j])));
            } else {
                zValues[j] = 0.0;
                pValues[j] = 1.0;
            }
            lower[j] = pooledCoef[j] - Z_CRITICAL * pooledSe[j];
            upper[j] = pooledCoef[j] + Z_CRITICAL * pooledSe[j];
        }

        int totalSampleSize = 0;
        double ssModel = 0.0;
        double ssResidual = 0.0;
        double dfResidual = 0.0;
        double weightedEta = 0.0;
        for (LinearLocalStatisticsDTO site : sites) {
            totalSampleSize += site.sampleSize();
            ssModel += site.ssModel();
            ssResidual += site.ssResidual();
            dfResidual += site.dfResidual();
            weightedEta += site.partialEtaSquared() * site.sampleSize();
        }
        double ssTotal = ssModel + ssResidual;
        double dfModel = reference.dfModel();

        double fStatistic = 0.0;
        double fPvalue = 1.0;
        if (dfModel > 0 && dfResidual > 0 && ssResidual > 0) {
            fStatistic = (ssModel / dfModel) / (ssResidual / dfResidual);
            fPvalue = 1.0 - new FDistribution(dfModel, dfResidual).cumulativeProbability(fStatistic);
        }

        double rSquared = ssTotal > 0 ? ssModel / ssTotal : 0.0;
        double adjDenominator = totalSampleSize - dfModel - 1;
        double adjRSquared = adjDenominator > 0
                ? 1.0 - (1.0 - rSquared) * (totalSampleSize - 1) / adjDenominator
                : 0.0;
        double partialEta = totalSampleSize > 0 ? weightedEta / totalSampleSize : 0.0;

        LOG.infof("Aggregated %d sites, total sample size %d", sites.size(), totalSampleSize);
        LOG.infof("Pooled R² = %.4f, adj R² = %.4f, F = %.4f (p = %.6f)",
                rSquared, adjRSquared, fStatistic, fPvalue);
        LOG.infof("Pooled partial η² (weighted): %.4f", partialEta);
        LOG.debugf("Pooled coefficients: %s", Arrays.toString(pooledCoef));
        LOG.debugf("Pooled standard errors: %s", Arrays.toString(pooledSe));

        return new LinearGlobalStatisticsDTO(
                totalSampleSize, totalSampleSize, sites.size(),
                pooledCoef, pooledSe, zValues, pValues, lower, upper,
                rSquared, adjRSquared, fStatistic, fPvalue,
                ssModel, ssResidual, ssTotal, dfModel, dfResidual,
                partialEta, reference.nGroupColumns());
    }

    private static void validateShapes(List<LinearLocalStatisticsDTO> sites) {
        LinearLocalStatisticsDTO reference = sites.get(0);
        int k = reference.coef().length;
        if (k == 0) {
            throw RoundFailureException.shapeMismatch("coef_", "at least one coefficient", 0);
        }
        for (LinearLocalStatisticsDTO site : sites) {
            checkLength("coef_", k, site.coef());
            checkLength("std_err", k, site.stdErr());
            checkLength("t_values", k, site.tValues());
            checkLength("p_values", k, site.pValues());
            checkLength("conf_int_lower", k, site.confIntLower());
            checkLength("conf_int_upper", k, site.confIntUpper());
            if (Double.compare(site.dfModel(), reference.dfModel()) != 0) {
                throw RoundFailureException.shapeMismatch("df_model", reference.dfModel(), site.dfModel());
            }
            if (site.nGroupColumns() != reference.nGroupColumns()) {
                throw RoundFailureException.shapeMismatch(
                        "n_group_columns", reference.nGroupColumns(), site.nGroupColumns());
            }
        }
    }

    private static void checkLength(String field, int expected, double[] values) {
        int actual = values == null ? 0 : values.length;
        if (actual != expected) {
            throw RoundFailureException.shapeMismatch(field, expected, actual);
        }
    }
}
