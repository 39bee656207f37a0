/* (C)2026 */
package com.ammann.fedstats.health;

import com.ammann.fedstats.store.ArtifactStore;
import com.ammann.fedstats.store.FileArtifactStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check for the artifact store.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: the store accepts writes</li>
 *   <li>DOWN: the store root cannot be created or is read-only</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class ArtifactStoreHealthCheck implements HealthCheck {

    @Inject ArtifactStore store;

    @Override
    public HealthCheckResponse call() {
        boolean writable = store.isWritable();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("artifact-store")
                .status(writable)
                .withData("writable", writable);
        if (store instanceof FileArtifactStore fileStore) {
            builder.withData("root", fileStore.getRoot().toString());
        }
        return builder.build();
    }
}
