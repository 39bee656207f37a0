/* (C)2026 */
package com.ammann.fedstats.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Pooled linear-model statistics the coordinator publishes for a round.
 * <p>
 * Carries z-values instead of t-values: the pooled estimate is a weighted sum of independent
 * site estimates and is tested against the standard normal distribution.
 */
@Schema(description = "Inverse-variance-weighted meta-analysis of all site OLS fits for one round")
public record LinearGlobalStatisticsDTO(
        @JsonProperty("sample_size") int sampleSize,
        @JsonProperty("total_sample_size") int totalSampleSize,
        @JsonProperty("n_sites") int nSites,
        @JsonProperty("coef_") double[] coef,
        @JsonProperty("std_err") double[] stdErr,
        @JsonProperty("z_values") double[] zValues,
        @JsonProperty("p_values") double[] pValues,
        @JsonProperty("conf_int_lower") double[] confIntLower,
        @JsonProperty("conf_int_upper") double[] confIntUpper,
        @JsonProperty("r_squared") double rSquared,
        @JsonProperty("adj_r_squared") double adjRSquared,
        @JsonProperty("f_statistic") double fStatistic,
        @JsonProperty("f_pvalue") double fPvalue,
        @JsonProperty("ss_model") double ssModel,
        @JsonProperty("ss_residual") double ssResidual,
        @JsonProperty("ss_total") double ssTotal,
        @JsonProperty("df_model") double dfModel,
        @JsonProperty("df_residual") double dfResidual,
        @JsonProperty("partial_eta_squared") double partialEtaSquared,
        @JsonProperty("n_group_columns") int nGroupColumns) implements StatisticsPayload {

    @Override
    @JsonIgnore
    public boolean isFinite() {
        return StatisticsPayload.allFinite(coef) && StatisticsPayload.allFinite(stdErr)
                && StatisticsPayload.allFinite(zValues) && StatisticsPayload.allFinite(pValues)
                && StatisticsPayload.allFinite(confIntLower) && StatisticsPayload.allFinite(confIntUpper)
                && StatisticsPayload.allFinite(rSquared, adjRSquared, fStatistic, fPvalue, ssModel,
                        ssResidual, ssTotal, dfModel, dfResidual, partialEtaSquared);
    }
}
