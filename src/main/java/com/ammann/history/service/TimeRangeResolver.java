/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.exception.ValidationException;
import com.ammann.history.model.TimeRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Resolves the time range parameters of a history request into a {@link TimeRange}.
 *
 * <p>Accepted combinations, checked in this order:
 * <ol>
 *   <li>{@code start} + {@code duration} (deprecated; {@code start=now} means duration only)</li>
 *   <li>{@code duration}: the window ending now</li>
 *   <li>{@code from} + {@code duration}</li>
 *   <li>{@code to} + {@code duration}</li>
 *   <li>{@code from}: from the given instant until now</li>
 *   <li>{@code from} + {@code to}</li>
 * </ol>
 * Datetimes without an offset are local time unless {@code useUTC} is set.
 */
@ApplicationScoped
public class TimeRangeResolver {

    private static final Logger LOG = Logger.getLogger(TimeRangeResolver.class);

    private static final Pattern DURATION = Pattern.compile("^(\\d+)([smhd])$");

    static final String ACCEPTED_COMBINATIONS =
            "Accepted combinations: duration; from + duration; to + duration; from; from + to;"
                    + " start + duration (deprecated)";

    @Inject Clock clock;

    public TimeRangeResolver() {}

    public TimeRangeResolver(Clock clock) {
        this.clock = clock;
    }

    public TimeRange resolve(String duration, String from, String to, String start, boolean useUtc) {
        boolean hasDuration = isPresent(duration);
        boolean hasFrom = isPresent(from);
        boolean hasTo = isPresent(to);
        boolean hasStart = isPresent(start);

        if (hasStart && hasDuration) {
            LOG.debugf("Deprecated start parameter used: start=%s duration=%s", start, duration);
            Duration span = parseDuration(duration);
            if ("now".equalsIgnoreCase(start.trim())) {
                return endingAt(clock.instant(), span);
            }
            return endingAt(parseDateTime(start, "start", useUtc), span);
        }
        if (hasDuration && !hasFrom && !hasTo) {
            return endingAt(clock.instant(), parseDuration(duration));
        }
        if (hasFrom && hasDuration && !hasTo) {
            Instant begin = parseDateTime(from, "from", useUtc);
            return new TimeRange(begin, plus(begin, parseDuration(duration)));
        }
        if (hasTo && hasDuration && !hasFrom) {
            return endingAt(parseDateTime(to, "to", useUtc), parseDuration(duration));
        }
        if (hasFrom && !hasTo && !hasDuration) {
            return new TimeRange(parseDateTime(from, "from", useUtc), clock.instant());
        }
        if (hasFrom && hasTo && !hasDuration) {
            return new TimeRange(parseDateTime(from, "from", useUtc), parseDateTime(to, "to", useUtc));
        }
        throw new ValidationException("Invalid combination of time range parameters. " + ACCEPTED_COMBINATIONS);
    }

    /**
     * Parses {@code <n>s|m|h|d} into milliseconds.
     */
    public long parseDurationMillis(String duration) {
        return parseDuration(duration).toMillis();
    }

    Duration parseDuration(String duration) {
        Matcher matcher = DURATION.matcher(duration == null ? "" : duration.trim());
        if (!matcher.matches()) {
            throw ValidationException.invalidParameter(
                    "duration", duration, "a number followed by s, m, h or d (e.g. 15m)");
        }
        try {
            long amount = Long.parseLong(matcher.group(1));
            long factor = switch (matcher.group(2)) {
                case "s" -> 1_000L;
                case "m" -> 60_000L;
                case "h" -> 3_600_000L;
                default -> 86_400_000L;
            };
            return Duration.ofMillis(Math.multiplyExact(amount, factor));
        } catch (NumberFormatException | ArithmeticException e) {
            throw ValidationException.invalidParameter("duration", duration, "a duration that fits the supported range");
        }
    }

    Instant parseDateTime(String value, String parameter, boolean useUtc) {
        String text = value.trim();
        try {
            TemporalAccessor parsed =
                    DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            ZoneId zone = useUtc ? ZoneOffset.UTC : clock.getZone();
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValidationException(String.format(
                    "Invalid datetime '%s' for parameter '%s'. Use ISO-8601 with offset"
                            + " (e.g. 2025-08-11T05:26:04Z) or local time (e.g. 2025-08-11T05:26:04)",
                    value, parameter), e);
        }
    }

    private static TimeRange endingAt(Instant end, Duration span) {
        return new TimeRange(minus(end, span), end);
    }

    private static Instant plus(Instant instant, Duration duration) {
        try {
            return instant.plus(duration);
        } catch (ArithmeticException | DateTimeException e) {
            throw ValidationException.invalidParameter("duration", duration, "a duration within the supported time range");
        }
    }

    private static Instant minus(Instant instant, Duration duration) {
        try {
            return instant.minus(duration);
        } catch (ArithmeticException | DateTimeException e) {
            throw ValidationException.invalidParameter("duration", duration, "a duration within the supported time range");
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
