/* (C)2026 */
package com.ammann.history.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Fixed-width timestamp renderings shared by the query engine and the response.
 *
 * <p>Bucket timestamps always carry milliseconds and a {@code Z} suffix so that their
 * lexicographic order equals their chronological order.
 */
public final class TimeFormats {

    private static final DateTimeFormatter UTC_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter ZONED_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");

    private static final DateTimeFormatter SQL_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private TimeFormats() {}

    public static String utc(Instant instant) {
        return UTC_MILLIS.format(instant);
    }

    public static String utcFromEpochMillis(long epochMillis) {
        return utc(Instant.ofEpochMilli(epochMillis));
    }

    public static String zoned(Instant instant, ZoneId zone) {
        return ZONED_MILLIS.format(instant.atZone(zone));
    }

    /** Naive UTC rendering bound to {@code CAST(? AS TIMESTAMP)} parameters. */
    public static String sqlTimestamp(Instant instant) {
        return SQL_TIMESTAMP.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }
}
