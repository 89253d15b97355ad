/* (C)2026 */
package com.ammann.history.cache;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Discovery cache key. Both bounds are truncated to the start of their minute so that
 * requests issued within the same minute share an entry.
 *
 * @param context context the scan was made for, {@code null} for context-wide scans
 * @param from window start, truncated to the minute
 * @param to window end, truncated to the minute
 */
public record CacheKey(String context, Instant from, Instant to) {

    public static CacheKey of(String context, Instant from, Instant to) {
        return new CacheKey(
                context, from.truncatedTo(ChronoUnit.MINUTES), to.truncatedTo(ChronoUnit.MINUTES));
    }
}
