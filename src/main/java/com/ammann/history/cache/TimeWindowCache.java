/* (C)2026 */
package com.ammann.history.cache;

import com.ammann.history.dto.CacheStatsDTO;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * TTL- and capacity-bounded cache for results of discovery scans over a time window.
 *
 * <p>Entries expire {@code ttl} after insertion. When the cache is full, the entry with
 * the oldest insertion time is evicted; reads do not refresh an entry. All operations
 * synchronize on the cache instance.
 *
 * @param <V> cached value type, expected to be immutable
 */
public class TimeWindowCache<V> {

    private static final Logger LOG = Logger.getLogger(TimeWindowCache.class);

    private final String name;
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final Map<CacheKey, Entry<V>> entries = new HashMap<>();

    public TimeWindowCache(String name, Duration ttl, int maxEntries, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + maxEntries);
        }
        this.name = name;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * Returns the live value for the window, or {@code null} when absent or expired.
     * An expired entry is removed.
     */
    public synchronized V get(String context, Instant from, Instant to) {
        CacheKey key = CacheKey.of(context, from, to);
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key);
            LOG.debugf("[%s] expired entry removed: %s", name, key);
            return null;
        }
        return entry.value();
    }

    public synchronized void put(String context, Instant from, Instant to, V value) {
        CacheKey key = CacheKey.of(context, from, to);
        if (!entries.containsKey(key) && entries.size() >= maxEntries) {
            evictOldest();
        }
        entries.put(key, new Entry<>(value, clock.instant()));
    }

    /**
     * Removes every expired entry.
     *
     * @return number of removed entries
     */
    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Entry<V>> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (isExpired(iterator.next(), now)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStatsDTO stats() {
        return new CacheStatsDTO(entries.size(), maxEntries, ttl.toMillis());
    }

    private void evictOldest() {
        entries.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().insertedAt()))
                .map(Map.Entry::getKey)
                .ifPresent(oldest -> {
                    entries.remove(oldest);
                    LOG.debugf("[%s] capacity %d reached, evicted %s", name, maxEntries, oldest);
                });
    }

    private boolean isExpired(Entry<V> entry, Instant now) {
        return Duration.between(entry.insertedAt(), now).compareTo(ttl) >= 0;
    }

    private record Entry<V>(V value, Instant insertedAt) {}
}
