/* (C)2026 */
package com.ammann.history.model;

import com.ammann.history.exception.ValidationException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Resolved, half-open query window {@code [from, to)} in UTC.
 *
 * @param from inclusive lower bound
 * @param to exclusive upper bound, strictly after {@code from}
 */
public record TimeRange(Instant from, Instant to) {

    public TimeRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (!from.isBefore(to)) {
            throw new ValidationException(
                    String.format("Invalid time range: from (%s) must be before to (%s)", from, to));
        }
    }

    public Duration span() {
        return Duration.between(from, to);
    }
}
