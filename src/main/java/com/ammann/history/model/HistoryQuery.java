/* (C)2026 */
package com.ammann.history.model;

import java.util.List;

/**
 * Fully parsed history values request.
 *
 * @param context resolved context, e.g. {@code vessels.urn:mrn:imo:mmsi:368396230}
 * @param range resolved query window
 * @param pathSpecs requested paths in response column order
 * @param resolutionMillis bucket width
 * @param bbox bounding box, passed through untouched
 * @param refresh whether the response is marked as a pollable live source
 * @param includeMovingAverages whether EMA/SMA columns are added
 * @param convertUnits whether preferred-unit conversion is applied
 * @param convertTimesToLocal whether timestamps are re-expressed in a target zone
 * @param timezone requested zone id, may be {@code null}
 */
public record HistoryQuery(
        String context,
        TimeRange range,
        List<PathSpec> pathSpecs,
        long resolutionMillis,
        String bbox,
        boolean refresh,
        boolean includeMovingAverages,
        boolean convertUnits,
        boolean convertTimesToLocal,
        String timezone) {

    public HistoryQuery {
        pathSpecs = List.copyOf(pathSpecs);
    }
}
