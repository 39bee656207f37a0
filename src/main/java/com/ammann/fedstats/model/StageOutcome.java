/* (C)2026 */
package com.ammann.fedstats.model;

import com.ammann.fedstats.enumeration.FailureKind;
import com.ammann.fedstats.enumeration.RoundStage;

/**
 * Result of one lifecycle stage or of a whole round.
 *
 * @param success whether the stage completed
 * @param stage   stage the controller is in afterwards
 * @param failure failure reason, null on success
 * @param message human-readable detail, null on success
 */
public record StageOutcome(boolean success, RoundStage stage, FailureKind failure, String message) {

    public static StageOutcome ok(RoundStage stage) {
        return new StageOutcome(true, stage, null, null);
    }

    public static StageOutcome failed(FailureKind failure, String message) {
        return new StageOutcome(false, RoundStage.FAILED, failure, message);
    }

    /**
     * A coordinator round that is still waiting for payloads. The controller stays in its
     * current stage so the round can be retried.
     */
    public static StageOutcome notReady(RoundStage stage, String message) {
        return new StageOutcome(false, stage, FailureKind.AGGREGATION_NOT_READY, message);
    }

    public boolean isNotReady() {
        return failure == FailureKind.AGGREGATION_NOT_READY;
    }
}
