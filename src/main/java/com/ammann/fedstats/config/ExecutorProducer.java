/* (C)2026 */
package com.ammann.fedstats.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the named ManagedExecutor used by blocking coordinator waits.
 *
 * <p>A request that asks the coordinator to wait for a round runs on this executor so the
 * HTTP I/O thread is never blocked while the readiness gate polls the artifact store.
 */
@ApplicationScoped
public class ExecutorProducer {

    @Produces
    @Named("coordinator-executor")
    @ApplicationScoped
    public ManagedExecutor createCoordinatorExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(4)
                .maxQueued(32)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }
}
