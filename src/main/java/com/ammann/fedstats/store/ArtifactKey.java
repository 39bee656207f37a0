/* (C)2026 */
package com.ammann.fedstats.store;

import com.ammann.fedstats.model.RoundReference;

/**
 * Address of one blob in the artifact store.
 * <p>
 * Local payload keys name the participant; the global payload key of a round has none.
 */
public record ArtifactKey(String runId, RoundReference round, String participant) {

    public ArtifactKey {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("Run id must not be blank");
        }
        if (round == null) {
            throw new IllegalArgumentException("Round reference must not be null");
        }
        if (participant != null && !participant.matches("[A-Za-z0-9._-]+")) {
            throw new IllegalArgumentException("Invalid participant id: " + participant);
        }
    }

    public static ArtifactKey local(String runId, RoundReference round, String participant) {
        if (participant == null) {
            throw new IllegalArgumentException("Local payload key requires a participant");
        }
        return new ArtifactKey(runId, round, participant);
    }

    public static ArtifactKey global(String runId, RoundReference round) {
        return new ArtifactKey(runId, round, null);
    }

    public boolean isGlobal() {
        return participant == null;
    }

    @Override
    public String toString() {
        return runId + "/" + round + (isGlobal() ? "/global" : "/" + participant);
    }
}
