/* (C)2026 */
package com.ammann.fedstats.enumeration;

/**
 * Stage reached by a round lifecycle controller.
 * <p>
 * Participant sequence is INITIAL to DATA_READY to VALIDATED to TRAINED to PUBLISHED.
 * The coordinator moves from INITIAL to COLLECTED to PUBLISHED. FAILED is reachable from any stage.
 */
public enum RoundStage {
    /** Controller created, nothing loaded */
    INITIAL,
    /** Local dataset loaded and split */
    DATA_READY,
    /** Prior-round artifacts confirmed */
    VALIDATED,
    /** Local model fitted and statistics computed */
    TRAINED,
    /** Coordinator has a complete payload set for the round */
    COLLECTED,
    /** Payload written to the artifact store */
    PUBLISHED,
    /** A stage failed; nothing further is published for this round */
    FAILED;

    /**
     * Whether no further transition is possible.
     *
     * @return true for PUBLISHED and FAILED
     */
    public boolean isTerminal() {
        return this == PUBLISHED || this == FAILED;
    }
}
