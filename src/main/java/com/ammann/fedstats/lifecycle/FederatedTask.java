/* (C)2026 */
package com.ammann.fedstats.lifecycle;

import com.ammann.fedstats.dto.StatisticsPayload;
import com.ammann.fedstats.enumeration.ModelKind;
import java.util.Collection;

/**
 * Capabilities one model kind contributes to a federated round.
 * <p>
 * Site stages run in order on one instance; an instance holds the state of a single round.
 * Every method signals failure by throwing
 * {@link com.ammann.fedstats.exception.RoundFailureException}; the
 * {@link RoundLifecycleController} turns that into a failed stage.
 *
 * @param <L> local payload type
 * @param <G> global payload type
 */
public interface FederatedTask<L extends StatisticsPayload, G extends StatisticsPayload> {

    ModelKind modelKind();

    Class<L> localPayloadType();

    /** Loads and splits the site's dataset. */
    void prepareData(RoundContext context);

    /** Confirms artifacts required before fitting, such as the previous round's global payload. */
    void validate(RoundContext context);

    /** Fits the local model and returns the payload to publish. */
    L training(RoundContext context);

    /** Combines the local payloads of one round. Pure: never touches the store. */
    G aggregate(Collection<L> payloads);
}
