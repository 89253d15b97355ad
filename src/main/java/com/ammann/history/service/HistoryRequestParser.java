/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.dto.HistoryQueryParamsDTO;
import com.ammann.history.exception.ValidationException;
import com.ammann.history.model.HistoryQuery;
import com.ammann.history.model.PathSpec;
import com.ammann.history.model.TimeRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Turns raw query parameters into a validated {@link HistoryQuery}.
 */
@ApplicationScoped
public class HistoryRequestParser {

    static final String SELF = "self";
    static final String VESSELS_SELF = "vessels.self";

    @Inject TimeRangeResolver timeRangeResolver;

    @Inject PathSpecParser pathSpecParser;

    @ConfigProperty(
            name = "history.self-id",
            defaultValue = "urn:mrn:signalk:uuid:00000000-0000-0000-0000-000000000000")
    String selfId;

    @ConfigProperty(name = "history.resolution.divisor", defaultValue = "500")
    long resolutionDivisor;

    public HistoryQuery parseValuesQuery(HistoryQueryParamsDTO params) {
        TimeRange range = parseRange(params);
        List<PathSpec> pathSpecs = pathSpecParser.parse(params.paths);
        if (pathSpecs.isEmpty()) {
            throw ValidationException.invalidParameter(
                    "paths", params.paths, "a comma-separated list of path[:method] entries");
        }
        return new HistoryQuery(
                resolveContext(params.context),
                range,
                pathSpecs,
                resolveResolution(params.resolution, range),
                params.bbox,
                HistoryQueryParamsDTO.isEnabled(params.refresh),
                HistoryQueryParamsDTO.isEnabled(params.includeMovingAverages),
                HistoryQueryParamsDTO.isEnabled(params.convertUnits),
                HistoryQueryParamsDTO.isEnabled(params.convertTimesToLocal),
                params.timezone);
    }

    public TimeRange parseRange(HistoryQueryParamsDTO params) {
        return timeRangeResolver.resolve(
                params.duration, params.from, params.to, params.start,
                HistoryQueryParamsDTO.isEnabled(params.useUTC));
    }

    /**
     * Maps {@code self} and {@code vessels.self} (or no context) to this vessel's context.
     */
    public String resolveContext(String context) {
        if (context == null || context.isBlank()) {
            return "vessels." + selfId;
        }
        String trimmed = context.replace(" ", "");
        if (SELF.equals(trimmed) || VESSELS_SELF.equals(trimmed)) {
            return "vessels." + selfId;
        }
        return trimmed;
    }

    /**
     * Explicit bucket width in milliseconds, or the window span divided by the configured
     * divisor.
     */
    public long resolveResolution(String resolution, TimeRange range) {
        if (resolution == null || resolution.isBlank()) {
            return Math.max(1L, range.span().toMillis() / resolutionDivisor);
        }
        double millis;
        try {
            millis = Double.parseDouble(resolution.trim());
        } catch (NumberFormatException e) {
            throw ValidationException.invalidParameter("resolution", resolution, "a positive number of milliseconds");
        }
        if (!Double.isFinite(millis) || millis <= 0) {
            throw ValidationException.invalidParameter("resolution", resolution, "a positive number of milliseconds");
        }
        return Math.max(1L, Math.round(millis));
    }
}
