/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.dto.RangeDTO;
import com.ammann.history.dto.TimezoneInfoDTO;
import com.ammann.history.model.TimeRange;
import com.ammann.history.util.TimeFormats;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Re-expresses row timestamps and the query window in a target zone.
 */
@ApplicationScoped
public class TimezoneConversionService {

    private static final Logger LOG = Logger.getLogger(TimezoneConversionService.class);

    @Inject Clock clock;

    /**
     * Converted rows, range and the zone that was applied.
     */
    public record Result(List<List<Object>> rows, RangeDTO range, TimezoneInfoDTO timezone) {}

    public Result apply(List<List<Object>> rows, TimeRange range, String timezone) {
        ZoneId zone = resolveZone(timezone);
        List<List<Object>> converted = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> copy = new ArrayList<>(row);
            copy.set(0, convertTimestamp(row.get(0), zone));
            converted.add(copy);
        }
        RangeDTO convertedRange = new RangeDTO(
                TimeFormats.zoned(range.from(), zone), TimeFormats.zoned(range.to(), zone));
        String offset = zone.getRules().getOffset(range.to()).getId();
        return new Result(converted, convertedRange, new TimezoneInfoDTO(zone.getId(), offset, true));
    }

    /**
     * Target zone: the requested one when valid, otherwise the process zone.
     */
    public ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return clock.getZone();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            LOG.warnf("Invalid timezone '%s', falling back to %s", timezone, clock.getZone());
            return clock.getZone();
        }
    }

    private static Object convertTimestamp(Object timestamp, ZoneId zone) {
        if (!(timestamp instanceof String text)) {
            return timestamp;
        }
        try {
            return TimeFormats.zoned(Instant.parse(text), zone);
        } catch (DateTimeParseException e) {
            LOG.debugf("Leaving unparseable timestamp '%s' unconverted", text);
            return timestamp;
        }
    }
}
