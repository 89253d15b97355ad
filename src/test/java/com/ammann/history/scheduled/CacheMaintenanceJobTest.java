/* (C)2026 */
package com.ammann.history.scheduled;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.history.cache.ContextCache;
import com.ammann.history.cache.PathCache;
import com.ammann.history.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class CacheMaintenanceJobTest {

    private static final Instant FROM = Instant.parse("2025-08-11T10:00:00Z");

    @Test
    void purgeDropsOnlyExpiredEntries() {
        MutableClock clock = MutableClock.at("2025-08-11T11:00:00Z");
        CacheMaintenanceJob job = new CacheMaintenanceJob();
        job.pathCache = new PathCache(Duration.ofSeconds(60), 100, clock);
        job.contextCache = new ContextCache(Duration.ofSeconds(60), 100, clock);

        job.pathCache.setCachedPaths("vessels.self", FROM, FROM.plusSeconds(3600), List.of("a"));
        job.contextCache.setCachedContexts(FROM, FROM.plusSeconds(3600), List.of("vessels.self"));
        clock.advance(Duration.ofSeconds(30));
        job.pathCache.setCachedPaths("vessels.self", FROM, FROM.plusSeconds(1800), List.of("b"));
        clock.advance(Duration.ofSeconds(45));

        job.purgeExpiredEntries();

        assertThat(job.pathCache.stats().size()).isEqualTo(1);
        assertThat(job.pathCache.getCachedPaths("vessels.self", FROM, FROM.plusSeconds(1800))).containsExactly("b");
        assertThat(job.contextCache.stats().size()).isZero();
    }
}
