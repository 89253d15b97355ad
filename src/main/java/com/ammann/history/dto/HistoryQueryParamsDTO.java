/* (C)2026 */
package com.ammann.history.dto;

import jakarta.ws.rs.QueryParam;

/**
 * Query parameters accepted by the history endpoints.
 *
 * <p>Time range parameters follow the Signal K history API: {@code duration},
 * {@code from}, {@code to} and the deprecated {@code start}. Boolean toggles accept
 * {@code true} or {@code 1}.</p>
 */
public class HistoryQueryParamsDTO {

    // Time range
    @QueryParam("duration")
    public String duration; // e.g. 15m, 1h, 2d

    @QueryParam("from")
    public String from; // ISO-8601

    @QueryParam("to")
    public String to; // ISO-8601

    @QueryParam("start")
    public String start; // deprecated, "now" or ISO-8601

    @QueryParam("useUTC")
    public String useUTC;

    // Selection
    @QueryParam("context")
    public String context;

    @QueryParam("paths")
    public String paths;

    @QueryParam("resolution")
    public String resolution; // bucket width in milliseconds

    @QueryParam("bbox")
    public String bbox;

    // Optional stages
    @QueryParam("refresh")
    public String refresh;

    @QueryParam("includeMovingAverages")
    public String includeMovingAverages;

    @QueryParam("convertUnits")
    public String convertUnits;

    @QueryParam("convertTimesToLocal")
    public String convertTimesToLocal;

    @QueryParam("timezone")
    public String timezone;

    /**
     * Interprets a boolean toggle parameter.
     *
     * @param value raw parameter value, may be {@code null}
     * @return {@code true} for {@code "true"} (any case) or {@code "1"}
     */
    public static boolean isEnabled(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        return "1".equals(trimmed) || "true".equalsIgnoreCase(trimmed);
    }
}
