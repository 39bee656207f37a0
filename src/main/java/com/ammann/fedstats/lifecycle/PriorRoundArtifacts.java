/* (C)2026 */
package com.ammann.fedstats.lifecycle;

import com.ammann.fedstats.exception.RoundFailureException;
import com.ammann.fedstats.model.RoundReference;
import com.ammann.fedstats.store.ArtifactKey;
import com.ammann.fedstats.store.ArtifactStore;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Reads the global payload of the round preceding the current one.
 */
public class PriorRoundArtifacts {

    private static final Logger LOG = Logger.getLogger(PriorRoundArtifacts.class);

    private final ArtifactStore store;

    public PriorRoundArtifacts(ArtifactStore store) {
        this.store = store;
    }

    /**
     * Returns the previous round's global blob.
     *
     * @return empty for the first round of a run
     * @throws RoundFailureException ARTIFACT_UNAVAILABLE when a previous round exists but the
     *                               coordinator has not published its global payload
     */
    public Optional<String> previousGlobal(RoundContext context) {
        Optional<RoundReference> previous = context.previousRound();
        if (previous.isEmpty()) {
            LOG.debugf("%s is the first round, no prior global payload", context);
            return Optional.empty();
        }
        ArtifactKey key = ArtifactKey.global(context.runId(), previous.get());
        String blob = store.read(key).orElseThrow(() -> RoundFailureException.artifactUnavailable(
                "Global payload " + key + " has not been published"));
        LOG.debugf("Fetched prior global payload %s", key);
        return Optional.of(blob);
    }
}
