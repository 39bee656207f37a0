/* (C)2026 */
package com.ammann.fedstats.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Kernel regression statistics, published locally by each site and globally by the coordinator.
 * <p>
 * {@code total_sample_size} and {@code n_sites} are only present on the global payload.
 */
@Schema(description = "Support vector regression dual solution and held-out metrics")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KernelStatisticsDTO(
        @JsonProperty("sample_size") int sampleSize,
        @Schema(description = "Dual coefficients (alpha - alpha*) of the support vectors, one row")
        @JsonProperty("dual_coef") double[][] dualCoef,
        @JsonProperty("intercept") double intercept,
        @JsonProperty("metric_mse") double metricMse,
        @JsonProperty("metric_rmse") double metricRmse,
        @JsonProperty("metric_mae") double metricMae,
        @JsonProperty("metric_r2") double metricR2,
        @JsonProperty("total_sample_size") Integer totalSampleSize,
        @JsonProperty("n_sites") Integer nSites) implements StatisticsPayload {

    /**
     * Creates a site payload without the coordinator-only fields.
     */
    public static KernelStatisticsDTO local(
            int sampleSize, double[][] dualCoef, double intercept, RegressionScores scores) {
        return new KernelStatisticsDTO(sampleSize, dualCoef, intercept,
                scores.mse(), scores.rmse(), scores.mae(), scores.r2(), null, null);
    }

    /**
     * Whether the payload carries a non-empty dual coefficient matrix.
     */
    @JsonIgnore
    public boolean hasDualSolution() {
        return dualCoef != null && dualCoef.length > 0 && dualCoef[0] != null && dualCoef[0].length > 0;
    }

    @Override
    @JsonIgnore
    public boolean isFinite() {
        return StatisticsPayload.allFinite(dualCoef)
                && StatisticsPayload.allFinite(intercept, metricMse, metricRmse, metricMae, metricR2);
    }
}
