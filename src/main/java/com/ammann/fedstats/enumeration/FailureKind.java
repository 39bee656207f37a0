/* (C)2026 */
package com.ammann.fedstats.enumeration;

/**
 * Typed reasons a round stage can fail.
 */
public enum FailureKind {
    /** Local dataset missing, empty or unreadable. Not retried within the round. */
    DATA_UNAVAILABLE(false),
    /** An artifact required before fitting (prior global payload, run descriptor) could not be read. */
    ARTIFACT_UNAVAILABLE(true),
    /** The local model fit raised or produced non-finite statistics. */
    FIT_FAILURE(false),
    /** Writing the payload to the artifact store failed. */
    PUBLISH_FAILURE(true),
    /** The coordinator found zero local payloads for the round. */
    AGGREGATION_INPUT_MISSING(false),
    /** Not every expected participant has published yet and the round is still open. */
    AGGREGATION_NOT_READY(true),
    /** Local payloads disagree in dimensionality or model structure. */
    AGGREGATION_SHAPE_MISMATCH(false),
    /** The round deadline or closure passed with fewer payloads than the minimum quorum. */
    QUORUM_NOT_MET(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() { return retryable; }
}
