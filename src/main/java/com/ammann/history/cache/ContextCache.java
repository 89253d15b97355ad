/* (C)2026 */
package com.ammann.history.cache;

import com.ammann.history.dto.CacheStatsDTO;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Process-wide cache of the contexts that have data within a time window.
 */
@ApplicationScoped
public class ContextCache {

    private final TimeWindowCache<List<String>> cache;

    @Inject
    public ContextCache(
            @ConfigProperty(name = "history.cache.ttl", defaultValue = "60s") Duration ttl,
            @ConfigProperty(name = "history.cache.max-entries", defaultValue = "100") int maxEntries,
            Clock clock) {
        this.cache = new TimeWindowCache<>("contexts", ttl, maxEntries, clock);
    }

    public List<String> getCachedContexts(Instant from, Instant to) {
        return cache.get(null, from, to);
    }

    public void setCachedContexts(Instant from, Instant to, List<String> contexts) {
        cache.put(null, from, to, List.copyOf(contexts));
    }

    public int purgeExpired() {
        return cache.purgeExpired();
    }

    public void clear() {
        cache.clear();
    }

    public CacheStatsDTO stats() {
        return cache.stats();
    }
}
