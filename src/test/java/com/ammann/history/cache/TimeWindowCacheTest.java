/* (C)2026 */
package com.ammann.history.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.history.dto.CacheStatsDTO;
import com.ammann.history.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimeWindowCacheTest {

    private static final Instant FROM = Instant.parse("2025-08-11T10:00:00Z");
    private static final Instant TO = Instant.parse("2025-08-11T11:00:00Z");

    private MutableClock clock;
    private TimeWindowCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-08-11T12:00:00Z");
        cache = new TimeWindowCache<>("test", Duration.ofSeconds(60), 3, clock);
    }

    @Test
    void returnsValueWithinTtl() {
        cache.put("ctx", FROM, TO, "value");
        clock.advance(Duration.ofSeconds(59));

        assertThat(cache.get("ctx", FROM, TO)).isEqualTo("value");
    }

    @Test
    void expiredEntryIsRemovedOnRead() {
        cache.put("ctx", FROM, TO, "value");
        clock.advance(Duration.ofSeconds(60));

        assertThat(cache.get("ctx", FROM, TO)).isNull();
        assertThat(cache.size()).isZero();
    }

    @Test
    void lookupWithinSameMinuteHits() {
        cache.put("ctx", FROM.plusSeconds(5), TO.plusSeconds(5), "value");

        assertThat(cache.get("ctx", FROM.plusSeconds(42), TO.plusSeconds(17))).isEqualTo("value");
        assertThat(cache.get("ctx", FROM.plusSeconds(60), TO)).isNull();
    }

    @Test
    void evictsOldestInsertionWhenFull() {
        cache.put("a", FROM, TO, "a");
        clock.advance(Duration.ofSeconds(1));
        cache.put("b", FROM, TO, "b");
        clock.advance(Duration.ofSeconds(1));
        cache.put("c", FROM, TO, "c");
        clock.advance(Duration.ofSeconds(1));

        // reads do not refresh "a"
        cache.get("a", FROM, TO);
        cache.put("d", FROM, TO, "d");

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("a", FROM, TO)).isNull();
        assertThat(cache.get("b", FROM, TO)).isEqualTo("b");
        assertThat(cache.get("d", FROM, TO)).isEqualTo("d");
    }

    @Test
    void replacingExistingKeyDoesNotEvict() {
        cache.put("a", FROM, TO, "a");
        cache.put("b", FROM, TO, "b");
        cache.put("c", FROM, TO, "c");

        cache.put("a", FROM, TO, "a2");

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("a", FROM, TO)).isEqualTo("a2");
        assertThat(cache.get("b", FROM, TO)).isEqualTo("b");
    }

    @Test
    void purgeExpiredRemovesOnlyStaleEntries() {
        cache.put("a", FROM, TO, "a");
        clock.advance(Duration.ofSeconds(30));
        cache.put("b", FROM, TO, "b");
        clock.advance(Duration.ofSeconds(31));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(cache.get("b", FROM, TO)).isEqualTo("b");
    }

    @Test
    void statsReportSizeCapacityAndTtl() {
        cache.put("a", FROM, TO, "a");

        assertThat(cache.stats()).isEqualTo(new CacheStatsDTO(1, 3, 60_000L));

        cache.clear();
        assertThat(cache.stats().size()).isZero();
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new TimeWindowCache<String>("x", Duration.ZERO, 1, clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeWindowCache<String>("x", Duration.ofSeconds(1), 0, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentWritersNeverExceedCapacity() throws Exception {
        TimeWindowCache<Integer> shared = new TimeWindowCache<>("shared", Duration.ofMinutes(1), 10, clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        shared.put("ctx-" + thread + "-" + i, FROM, TO, i);
                        shared.get("ctx-" + thread + "-" + (i / 2), FROM, TO);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(shared.size()).isEqualTo(10);
    }
}
