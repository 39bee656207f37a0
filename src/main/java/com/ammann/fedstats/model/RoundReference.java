/* (C)2026 */
package com.ammann.fedstats.model;

import java.util.Comparator;

/**
 * A (sequence, round) step within a run's task sequence.
 * <p>
 * Sequences are 1-based task positions, rounds are 0-based within a task. Ordering is
 * by sequence first, then round.
 */
public record RoundReference(int sequence, int round) implements Comparable<RoundReference> {

    private static final Comparator<RoundReference> ORDER =
            Comparator.comparingInt(RoundReference::sequence).thenComparingInt(RoundReference::round);

    public RoundReference {
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence must be >= 1, got " + sequence);
        }
        if (round < 0) {
            throw new IllegalArgumentException("Round must be >= 0, got " + round);
        }
    }

    /**
     * The first step of every run.
     */
    public static RoundReference first() {
        return new RoundReference(1, 0);
    }

    public boolean isFirst() {
        return sequence == 1 && round == 0;
    }

    @Override
    public int compareTo(RoundReference other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sequence + "-" + round;
    }
}
