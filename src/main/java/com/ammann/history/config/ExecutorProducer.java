/* (C)2026 */
package com.ammann.history.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the named ManagedExecutor that runs per-path history queries.
 *
 * <p>Concurrency is bounded by {@code history.query.max-concurrency}; further path
 * queries queue until a slot frees up.
 */
@ApplicationScoped
public class ExecutorProducer {

    @ConfigProperty(name = "history.query.max-concurrency", defaultValue = "10")
    int maxConcurrency;

    /**
     * Produces the executor shared by all history requests.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("history-query-executor")
    @ApplicationScoped
    public ManagedExecutor createHistoryQueryExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxConcurrency)
                .maxQueued(-1)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }
}
