/* (C)2026 */
package com.ammann.fedstats.dto;

import com.ammann.fedstats.model.RoundReference;
import com.ammann.fedstats.model.StageOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * REST view of a participant or coordinator round result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoundOutcomeDTO(
        @JsonProperty("run_id") String runId,
        @JsonProperty("sequence") int sequence,
        @JsonProperty("round") int round,
        @JsonProperty("participant") String participant,
        @JsonProperty("success") boolean success,
        @JsonProperty("stage") String stage,
        @JsonProperty("failure") String failure,
        @JsonProperty("message") String message) {

    public static RoundOutcomeDTO from(
            String runId, RoundReference ref, String participant, StageOutcome outcome) {
        return new RoundOutcomeDTO(
                runId,
                ref.sequence(),
                ref.round(),
                participant,
                outcome.success(),
                outcome.stage().name(),
                outcome.failure() != null ? outcome.failure().name() : null,
                outcome.message());
    }
}
