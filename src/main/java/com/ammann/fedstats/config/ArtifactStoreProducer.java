/* (C)2026 */
package com.ammann.fedstats.config;

import com.ammann.fedstats.store.ArtifactStore;
import com.ammann.fedstats.store.FileArtifactStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import java.nio.file.Path;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Produces the file-backed artifact store rooted at {@code federation.store.root}.
 */
@ApplicationScoped
public class ArtifactStoreProducer {

    private static final Logger LOG = Logger.getLogger(ArtifactStoreProducer.class);

    @ConfigProperty(name = "federation.store.root", defaultValue = "data/artifacts")
    String storeRoot;

    @Produces
    @ApplicationScoped
    public ArtifactStore artifactStore() {
        FileArtifactStore store = new FileArtifactStore(Path.of(storeRoot));
        LOG.infof("Artifact store rooted at %s", store.getRoot());
        return store;
    }
}
