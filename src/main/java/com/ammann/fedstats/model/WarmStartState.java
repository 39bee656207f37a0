/* (C)2026 */
package com.ammann.fedstats.model;

import com.ammann.fedstats.dto.KernelStatisticsDTO;

/**
 * Previous round's global kernel solution, read-only input to a site's next fit.
 *
 * @param dualCoef  dual coefficient rows as published by the coordinator
 * @param intercept pooled intercept
 */
public record WarmStartState(double[][] dualCoef, double intercept) {

    public static WarmStartState from(KernelStatisticsDTO global) {
        return new WarmStartState(global.dualCoef(), global.intercept());
    }

    /**
     * Returns the single dual row when the state has exactly one, which is the only shape the
     * regressor can be seeded from.
     *
     * @return the dual row, or null for any other shape
     */
    public double[] singleRow() {
        if (dualCoef == null || dualCoef.length != 1 || dualCoef[0] == null) {
            return null;
        }
        return dualCoef[0].clone();
    }
}
