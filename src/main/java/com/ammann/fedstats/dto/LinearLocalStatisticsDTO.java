/* (C)2026 */
package com.ammann.fedstats.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Statistics one site publishes after fitting the covariate-adjusted linear model.
 * <p>
 * Vector fields are indexed by coefficient, intercept first, then the group dummies,
 * then the covariates.
 */
@Schema(description = "Local OLS fit statistics of one site for one round")
public record LinearLocalStatisticsDTO(
        @JsonProperty("sample_size") int sampleSize,
        @JsonProperty("coef_") double[] coef,
        @JsonProperty("std_err") double[] stdErr,
        @JsonProperty("t_values") double[] tValues,
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
        @Schema(description = "Approximate partial eta-squared of the group effect, sum(t^2) / (sum(t^2) + df_residual)")
        @JsonProperty("partial_eta_squared") double partialEtaSquared,
        @JsonProperty("n_group_columns") int nGroupColumns) implements StatisticsPayload {

    @Override
    @JsonIgnore
    public boolean isFinite() {
        return coef != null && stdErr != null && tValues != null && pValues != null
                && confIntLower != null && confIntUpper != null
                && StatisticsPayload.allFinite(coef) && StatisticsPayload.allFinite(stdErr)
                && StatisticsPayload.allFinite(tValues) && StatisticsPayload.allFinite(pValues)
                && StatisticsPayload.allFinite(confIntLower) && StatisticsPayload.allFinite(confIntUpper)
                && StatisticsPayload.allFinite(rSquared, adjRSquared, fStatistic, fPvalue, ssModel,
                        ssResidual, ssTotal, dfModel, dfResidual, partialEtaSquared);
    }
}
