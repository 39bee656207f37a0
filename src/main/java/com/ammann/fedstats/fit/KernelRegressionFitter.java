/* (C)2026 */
package com.ammann.fedstats.fit;

import com.ammann.fedstats.dto.KernelStatisticsDTO;
import com.ammann.fedstats.dto.RegressionScores;
import com.ammann.fedstats.exception.RoundFailureException;
import com.ammann.fedstats.model.Dataset;
import com.ammann.fedstats.model.KernelHyperparameters;
import com.ammann.fedstats.model.TrainTestSplit;
import com.ammann.fedstats.model.WarmStartState;
import org.jboss.logging.Logger;

/**
 * Fits the kernel regression model of a site and scores it on the held-out partition.
 * <p>
 * Features are standardized with statistics of the training partition only. A warm-start
 * state seeds the solver only when it is shape-compatible with the current training data;
 * anything else is discarded and the fit starts cold.
 */
public class KernelRegressionFitter {

    private static final Logger LOG = Logger.getLogger(KernelRegressionFitter.class);

    static final double WARM_START_SUM_TOLERANCE = 1e-6;

    /**
     * Fits and scores the regressor.
     *
     * @param split           training and held-out partitions
     * @param hyperparameters solver settings; a null gamma selects the scale heuristic
     * @param warmStart       previous round's global solution, or null
     * @return local payload; {@code sample_size} counts both partitions
     * @throws RoundFailureException with FIT_FAILURE when the fit cannot produce finite output
     */
    public KernelStatisticsDTO fit(TrainTestSplit split, KernelHyperparameters hyperparameters,
            WarmStartState warmStart) {
        Dataset train = split.train();
        Dataset heldOut = split.heldOut();
        if (train.isEmpty() || heldOut.isEmpty()) {
            throw RoundFailureException.fitFailure(String.format(
                    "Kernel fit needs non-empty partitions, got %d training and %d held-out rows",
                    train.size(), heldOut.size()), null);
        }

        FeatureScaler scaler = FeatureScaler.fit(train.features());
        double[][] trainRows = scaler.transform(train.features());
        double[][] heldOutRows = scaler.transform(heldOut.features());
        double gamma = hyperparameters.gamma() != null
                ? hyperparameters.gamma()
                : scaleGamma(trainRows);

        double[] seed = warmStartSeed(warmStart, train.size(), hyperparameters.c());

        SupportVectorRegressor regressor;
        try {
            regressor = SupportVectorRegressor.train(trainRows, train.outcome(), hyperparameters, gamma, seed);
        } catch (RuntimeException e) {
            throw RoundFailureException.fitFailure("SVR fit failed: " + e.getMessage(), e);
        }

        RegressionScores scores = RegressionScores.of(heldOut.outcome(), regressor.predict(heldOutRows));
        KernelStatisticsDTO stats = KernelStatisticsDTO.local(
                train.size() + heldOut.size(),
                new double[][] {regressor.getDualCoef()},
                regressor.getIntercept(),
                scores);
        if (!stats.isFinite()) {
            throw RoundFailureException.fitFailure("SVR fit produced non-finite statistics", null);
        }

        LOG.infof("SVR fitted: %d support vectors, gamma = %.4f, intercept = %.4f",
                regressor.supportVectorCount(), gamma, regressor.getIntercept());
        LOG.infof("Held-out MSE = %.4f, RMSE = %.4f, MAE = %.4f, R² = %.4f",
                scores.mse(), scores.rmse(), scores.mae(), scores.r2());
        return stats;
    }

    /**
     * gamma = 1 / (n_features * Var(X)) over all scaled training values; 1.0 when the variance is zero.
     */
    static double scaleGamma(double[][] rows) {
        int features = rows[0].length;
        if (features == 0) {
            return 1.0;
        }
        double sum = 0.0;
        double sumSquares = 0.0;
        long count = 0;
        for (double[] row : rows) {
            for (double value : row) {
                sum += value;
                sumSquares += value * value;
                count++;
            }
        }
        double mean = sum / count;
        double variance = sumSquares / count - mean * mean;
        return variance > 0 ? 1.0 / (features * variance) : 1.0;
    }

    /**
     * Returns the seed dual solution, or null for a cold start.
     */
    static double[] warmStartSeed(WarmStartState warmStart, int trainingRows, double c) {
        if (warmStart == null) {
            return null;
        }
        double[] row = warmStart.singleRow();
        if (row == null) {
            LOG.warn("Warm-start state discarded: expected exactly one dual coefficient row");
            return null;
        }
        if (row.length != trainingRows) {
            LOG.warnf("Warm-start state discarded: %d dual coefficients for %d training rows",
                    row.length, trainingRows);
            return null;
        }
        double sum = 0.0;
        for (double value : row) {
            if (!Double.isFinite(value) || Math.abs(value) > c) {
                LOG.warnf("Warm-start state discarded: coefficient %.4f outside [-%.4f, %.4f]", value, c, c);
                return null;
            }
            sum += value;
        }
        if (Math.abs(sum) > WARM_START_SUM_TOLERANCE) {
            LOG.warnf("Warm-start state discarded: dual coefficients sum to %.6f, expected 0", sum);
            return null;
        }
        LOG.debugf("Seeding SVR solver from warm-start state with %d coefficients", row.length);
        return row;
    }
}
