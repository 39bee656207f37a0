/* (C)2026 */
package com.ammann.fedstats.store;

import com.ammann.fedstats.model.RoundReference;
import java.util.List;
import java.util.Optional;

/**
 * Keyed blob storage shared by sites and the coordinator.
 * <p>
 * Every key is write-once and each write is atomic: readers see either nothing or the
 * complete blob. Implementations throw {@link com.ammann.fedstats.exception.ArtifactStoreException}
 * on I/O failure and on a second write to the same key.
 */
public interface ArtifactStore {

    /**
     * Publishes a blob under a key that has not been written before.
     */
    void write(ArtifactKey key, String blob);

    /**
     * Reads one blob.
     *
     * @return the blob, or empty if nothing was published under the key
     */
    Optional<String> read(ArtifactKey key);

    /**
     * Returns every local payload blob of a round regardless of participant, ordered by
     * participant id.
     */
    List<String> listLocal(String runId, RoundReference round);

    /**
     * Marks a round as closed: no further local payloads are expected.
     */
    void close(String runId, RoundReference round);

    boolean isClosed(String runId, RoundReference round);

    /**
     * Stores a run descriptor; a run id can only be submitted once.
     */
    void writeRun(String runId, String descriptor);

    Optional<String> readRun(String runId);

    /**
     * Whether the store can currently accept writes.
     */
    boolean isWritable();
}
