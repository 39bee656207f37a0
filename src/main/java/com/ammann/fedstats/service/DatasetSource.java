/* (C)2026 */
package com.ammann.fedstats.service;

import com.ammann.fedstats.model.Dataset;

/**
 * Supplies a participant's local records for a run. Records never leave the site.
 */
public interface DatasetSource {

    /**
     * Loads the dataset of one participant.
     *
     * @throws com.ammann.fedstats.exception.RoundFailureException DATA_UNAVAILABLE when the
     *         dataset does not exist or cannot be parsed
     */
    Dataset load(String runId, String participant);
}
