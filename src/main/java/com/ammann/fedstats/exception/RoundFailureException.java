/* (C)2026 */
package com.ammann.fedstats.exception;

import com.ammann.fedstats.enumeration.FailureKind;

/**
 * Typed failure raised inside a round stage.
 *
 * <p>Never escapes a round lifecycle controller: the controller converts it into a failed
 * {@link com.ammann.fedstats.model.StageOutcome} carrying the same {@link FailureKind}.
 */
public class RoundFailureException extends ApiException {

    private final FailureKind kind;

    public RoundFailureException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RoundFailureException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    public static RoundFailureException dataUnavailable(String message) {
        return new RoundFailureException(FailureKind.DATA_UNAVAILABLE, message);
    }

    public static RoundFailureException dataUnavailable(String message, Throwable cause) {
        return new RoundFailureException(FailureKind.DATA_UNAVAILABLE, message, cause);
    }

    public static RoundFailureException artifactUnavailable(String message) {
        return new RoundFailureException(FailureKind.ARTIFACT_UNAVAILABLE, message);
    }

    public static RoundFailureException fitFailure(String message, Throwable cause) {
        return new RoundFailureException(FailureKind.FIT_FAILURE, message, cause);
    }

    public static RoundFailureException inputMissing(String message) {
        return new RoundFailureException(FailureKind.AGGREGATION_INPUT_MISSING, message);
    }

    /**
     * Creates a shape mismatch failure for a payload field that differs between sites.
     */
    public static RoundFailureException shapeMismatch(String field, Object expected, Object actual) {
        return new RoundFailureException(
                FailureKind.AGGREGATION_SHAPE_MISMATCH,
                String.format("Local payloads disagree on '%s': expected %s, got %s", field, expected, actual));
    }
}
