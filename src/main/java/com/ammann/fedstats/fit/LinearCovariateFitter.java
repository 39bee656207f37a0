/* (C)2026 */
package com.ammann.fedstats.fit;

import com.ammann.fedstats.dto.LinearLocalStatisticsDTO;
import com.ammann.fedstats.exception.RoundFailureException;
import com.ammann.fedstats.model.Dataset;
import java.util.Arrays;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.jboss.logging.Logger;

/**
 * Fits the covariate-adjusted group comparison model by ordinary least squares.
 *
 * <p>The design matrix holds {@code n_group_columns} dummy-coded group indicators followed by
 * continuous covariates; an intercept is added at coefficient index 0. The fit uses the QR
 * decomposition of {@link OLSMultipleLinearRegression}; all inference (t, p, confidence
 * intervals, F) is derived from its residuals.
 *
 * <p>Guards keep every published number finite: a zero standard error yields t = 0 and p = 1,
 * a zero residual mean square yields F = 0 and p = 1.
 */
public class LinearCovariateFitter {

    private static final Logger LOG = Logger.getLogger(LinearCovariateFitter.class);

    static final double CONFIDENCE_LEVEL = 0.95;
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    /**
     * Fits the model on the training partition.
     *
     * @param train         training rows
     * @param nGroupColumns number of leading group-indicator columns
     * @return local statistics payload
     * @throws RoundFailureException with FIT_FAILURE when the design is singular, has no residual
     *                               degrees of freedom, or produces non-finite statistics
     */
    public LinearLocalStatisticsDTO fit(Dataset train, int nGroupColumns) {
        int n = train.size();
        int parameters = train.featureCount() + 1;
        if (n <= parameters) {
            throw RoundFailureException.fitFailure(String.format(
                    "Need more than %d rows to fit %d parameters, got %d", parameters, parameters, n), null);
        }

        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
        double[] beta;
        double[] stdErr;
        double ssResidual;
        double ssTotal;
        try {
            ols.newSampleData(train.outcome(), train.features());
            beta = ols.estimateRegressionParameters();
            stdErr = ols.estimateRegressionParametersStandardErrors();
            ssResidual = ols.calculateResidualSumOfSquares();
            ssTotal = ols.calculateTotalSumOfSquares();
        } catch (MathIllegalArgumentException | MathArithmeticException e) {
            throw RoundFailureException.fitFailure("OLS fit failed: " + e.getMessage(), e);
        }

        double dfModel = parameters - 1;
        double dfResidual = n - parameters;
        double ssModel = Math.max(0.0, ssTotal - ssResidual);

        TDistribution tDistribution = new TDistribution(dfResidual);
        double critical = tDistribution.inverseCumulativeProbability(0.5 + CONFIDENCE_LEVEL / 2.0);

        double[] tValues = new double[parameters];
        double[] pValues = new double[parameters];
        double[] lower = new double[parameters];
        double[] upper = new double[parameters];
        for (int i = 0; i < parameters; i++) {
            if (stdErr[i] > 0) {
                tValues[i] = beta[i] / stdErr[i];
                pValues[i] = 2.0 * (1.0 - tDistribution.cumulativeProbability(Math.abs(tValues[i])));
            } else {
                tValues[i] = 0.0;
                pValues[i] = 1.0;
            }
            lower[i] = beta[i] - critical * stdErr[i];
            upper[i] = beta[i] + critical * stdErr[i];
        }

        double rSquared = ssTotal > 0 ? 1.0 - ssResidual / ssTotal : 0.0;
        double adjRSquared = ssTotal > 0 ? 1.0 - (1.0 - rSquared) * (n - 1) / dfResidual : 0.0;

        double fStatistic = 0.0;
        double fPvalue = 1.0;
        double msResidual = ssResidual / dfResidual;
        if (dfModel > 0 && msResidual > 0) {
            fStatistic = (ssModel / dfModel) / msResidual;
            fPvalue = 1.0 - new FDistribution(dfModel, dfResidual).cumulativeProbability(fStatistic);
        }

        double partialEta = partialEtaSquared(tValues, nGroupColumns, dfResidual);

        LinearLocalStatisticsDTO stats = new LinearLocalStatisticsDTO(
                n, beta, stdErr, tValues, pValues, lower, upper,
                rSquared, adjRSquared, fStatistic, fPvalue,
                ssModel, ssResidual, ssTotal, dfModel, dfResidual,
                partialEta, nGroupColumns);

        if (!stats.isFinite()) {
            throw RoundFailureException.fitFailure("OLS fit produced non-finite statistics", null);
        }

        LOG.infof("Model fitted on %d rows. R² = %.4f, adj R² = %.4f", n, rSquared, adjRSquared);
        LOG.infof("F-statistic: %.4f, p = %.6f", fStatistic, fPvalue);
        LOG.infof("Partial η² (group effect): %.4f", partialEta);
        LOG.debugf("Coefficients: %s", Arrays.toString(beta));
        LOG.debugf("Standard errors: %s", Arrays.toString(stdErr));
        LOG.debugf("P-values: %s", Arrays.toString(pValues));
        return stats;
    }

    /**
     * Approximate partial eta-squared of the group effect.
     *
     * <p>Computes {@code sum(t_i^2) / (sum(t_i^2) + df_residual)} over the group coefficients at
     * indices {@code 1..nGroupColumns} (index 0 is the intercept). This is exact only for a
     * single-degree-of-freedom effect; it is not the Type III partial eta-squared, which would
     * require fitting the reduced model without the group columns.
     *
     * @param tValues       t-values of all coefficients, intercept first
     * @param nGroupColumns number of group-indicator columns
     * @param dfResidual    residual degrees of freedom
     * @return value in [0, 1]; 0 when there are no group columns, they are out of range,
     *         or the denominator is zero
     */
    public static double partialEtaSquared(double[] tValues, int nGroupColumns, double dfResidual) {
        if (nGroupColumns <= 0 || nGroupColumns >= tValues.length) {
            return 0.0;
        }
        double tSquaredSum = 0.0;
        for (int i = 1; i <= nGroupColumns; i++) {
            tSquaredSum += tValues[i] * tValues[i];
        }
        double denominator = tSquaredSum + dfResidual;
        return denominator > 0 ? tSquaredSum / denominator : 0.0;
    }
}
