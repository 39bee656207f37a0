/* (C)2026 */
package com.ammann.fedstats.enumeration;

/**
 * Result of evaluating whether a coordinator round may be aggregated.
 */
public enum ReadinessStatus {
    /** All expected participants published, or the round was closed/expired with quorum. */
    READY,
    /** Still waiting; aggregating now would use a partial set. */
    NOT_READY,
    /** Closed or expired with at least one but fewer than the minimum quorum of payloads. */
    QUORUM_NOT_MET,
    /** Closed or expired without a single payload. */
    EMPTY
}
