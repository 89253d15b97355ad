/* (C)2026 */
package com.ammann.history.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.history.model.TimeRange;
import com.ammann.history.support.MutableClock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimezoneConversionServiceTest {

    private static final TimeRange RANGE =
            new TimeRange(Instant.parse("2025-08-11T10:00:00Z"), Instant.parse("2025-08-11T11:00:00Z"));

    private TimezoneConversionService service;

    @BeforeEach
    void setUp() {
        service = new TimezoneConversionService();
        service.clock = new MutableClock(Instant.parse("2025-08-11T11:00:00Z"), ZoneId.of("America/New_York"));
    }

    private static List<List<Object>> rows() {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(List.of("2025-08-11T10:00:00.000Z", 1.0));
        rows.add(List.of("2025-08-11T10:01:00.000Z", 2.0));
        return rows;
    }

    @Test
    void rewritesTimestampsAndRangeInRequestedZone() {
        TimezoneConversionService.Result result = service.apply(rows(), RANGE, "Europe/Berlin");

        assertThat(result.rows()).extracting(row -> row.get(0))
                .containsExactly("2025-08-11T12:00:00.000+02:00", "2025-08-11T12:01:00.000+02:00");
        assertThat(result.rows().get(1).get(1)).isEqualTo(2.0);
        assertThat(result.range().from()).isEqualTo("2025-08-11T12:00:00.000+02:00");
        assertThat(result.range().to()).isEqualTo("2025-08-11T13:00:00.000+02:00");
        assertThat(result.timezone().zone()).isEqualTo("Europe/Berlin");
        assertThat(result.timezone().offset()).isEqualTo("+02:00");
        assertThat(result.timezone().converted()).isTrue();
    }

    @Test
    void invalidZoneFallsBackToProcessZone() {
        TimezoneConversionService.Result result = service.apply(rows(), RANGE, "Mars/Olympus");

        assertThat(result.timezone().zone()).isEqualTo("America/New_York");
        assertThat(result.rows().get(0).get(0)).isEqualTo("2025-08-11T06:00:00.000-04:00");
    }

    @Test
    void missingZoneUsesProcessZone() {
        assertThat(service.resolveZone(null)).isEqualTo(ZoneId.of("America/New_York"));
        assertThat(service.resolveZone("  ")).isEqualTo(ZoneId.of("America/New_York"));
        assertThat(service.resolveZone(" UTC ")).isEqualTo(ZoneId.of("UTC"));
    }

    @Test
    void inputRowsAreNotModified() {
        List<List<Object>> rows = rows();

        service.apply(rows, RANGE, "Asia/Tokyo");

        assertThat(rows.get(0).get(0)).isEqualTo("2025-08-11T10:00:00.000Z");
    }
}
