/* (C)2026 */
package com.ammann.fedstats.model;

import java.time.Duration;

/**
 * Synchronization contract the coordinator applies before aggregating a round.
 *
 * @param expectedParticipants participant count that makes a round complete; 0 when unknown
 * @param minQuorum            payloads required to aggregate after closure or deadline
 * @param maxWait              time a round may stay open after the coordinator first sees it
 * @param pollInterval         delay between store listings while blocking on a round
 */
public record QuorumPolicy(int expectedParticipants, int minQuorum, Duration maxWait, Duration pollInterval) {

    public QuorumPolicy {
        if (expectedParticipants < 0) {
            throw new IllegalArgumentException("Expected participants must be >= 0");
        }
        if (minQuorum < 1) {
            throw new IllegalArgumentException("Minimum quorum must be >= 1");
        }
        if (expectedParticipants > 0 && minQuorum > expectedParticipants) {
            throw new IllegalArgumentException(String.format(
                    "Minimum quorum %d exceeds expected participants %d", minQuorum, expectedParticipants));
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("Max wait must be a non-negative duration");
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
    }
}
