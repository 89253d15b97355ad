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
 * Process-wide cache of the paths that have data for a context within a time window.
 */
@ApplicationScoped
public class PathCache {

    private final TimeWindowCache<List<String>> cache;

    @Inject
    public PathCache(
            @ConfigProperty(name = "history.cache.ttl", defaultValue = "60s") Duration ttl,
            @ConfigProperty(name = "history.cache.max-entries", defaultValue = "100") int maxEntries,
            Clock clock) {
        this.cache = new TimeWindowCache<>("paths", ttl, maxEntries, clock);
    }

    public List<String> getCachedPaths(String context, Instant from, Instant to) {
        return cache.get(context, from, to);
    }

    public void setCachedPaths(String context, Instant from, Instant to, List<String> paths) {
        cache.put(context, from, to, List.copyOf(paths));
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
