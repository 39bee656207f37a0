/* (C)2026 */
package com.ammann.fedstats.fit;

import com.ammann.fedstats.model.KernelHyperparameters;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Fitted RBF-kernel epsilon-SVR: support vectors, their dual coefficients and the intercept.
 * <p>
 * Prediction is {@code f(x) = sum_k coef_k * exp(-gamma * |sv_k - x|^2) + intercept}.
 */
public final class SupportVectorRegressor {

    private static final Logger LOG = Logger.getLogger(SupportVectorRegressor.class);

    private final double[][] supportVectors;
    private final double[] dualCoef;
    private final double intercept;
    private final double gamma;

    SupportVectorRegressor(double[][] supportVectors, double[] dualCoef, double intercept, double gamma) {
        this.supportVectors = supportVectors;
        this.dualCoef = dualCoef;
        this.intercept = intercept;
        this.gamma = gamma;
    }

    /**
     * Trains a regressor on already scaled rows.
     *
     * @param rows           scaled training features
     * @param target         training outcomes
     * @param hyperparameters box constraint, tube width, solver tolerance and cap
     * @param gamma          RBF width to use
     * @param seedCoef       optional starting dual solution, one entry per training row, or null
     * @return fitted regressor holding only rows with a non-zero dual coefficient
     */
    public static SupportVectorRegressor train(double[][] rows, double[] target,
            KernelHyperparameters hyperparameters, double gamma, double[] seedCoef) {
        int l = rows.length;
        double[][] kernel = new double[l][l];
        for (int i = 0; i < l; i++) {
            kernel[i][i] = 1.0;
            for (int j = i + 1; j < l; j++) {
                double value = rbf(rows[i], rows[j], gamma);
                kernel[i][j] = value;
                kernel[j][i] = value;
            }
        }

        EpsilonSvrSolver.Solution solution = new EpsilonSvrSolver(kernel, target,
                hyperparameters.c(), hyperparameters.epsilon(), hyperparameters.tolerance(),
                hyperparameters.maxIterations(), seedCoef).solve();
        if (!solution.converged()) {
            LOG.warnf("SVR solver stopped after %d iterations without reaching tolerance %.1e",
                    solution.iterations(), hyperparameters.tolerance());
        } else {
            LOG.debugf("SVR solver converged after %d iterations", solution.iterations());
        }

        List<Integer> support = new ArrayList<>();
        for (int i = 0; i < l; i++) {
            if (solution.coef()[i] != 0.0) {
                support.add(i);
            }
        }
        double[][] vectors = new double[support.size()][];
        double[] coef = new double[support.size()];
        for (int k = 0; k < support.size(); k++) {
            vectors[k] = rows[support.get(k)].clone();
            coef[k] = solution.coef()[support.get(k)];
        }
        return new SupportVectorRegressor(vectors, coef, solution.intercept(), gamma);
    }

    static double rbf(double[] a, double[] b, double gamma) {
        double distance = 0.0;
        for (int d = 0; d < a.length; d++) {
            double diff = a[d] - b[d];
            distance += diff * diff;
        }
        return Math.exp(-gamma * distance);
    }

    public double predict(double[] row) {
        double value = intercept;
        for (int k = 0; k < supportVectors.length; k++) {
            value += dualCoef[k] * rbf(supportVectors[k], row, gamma);
        }
        return value;
    }

    public double[] predict(double[][] rows) {
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = predict(rows[i]);
        }
        return values;
    }

    public int supportVectorCount() {
        return supportVectors.length;
    }

    public double[] getDualCoef() {
        return dualCoef.clone();
    }

    public double getIntercept() {
        return intercept;
    }

    public double getGamma() {
        return gamma;
    }
}
