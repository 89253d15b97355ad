/* (C)2026 */
package com.ammann.history.model;

import com.ammann.history.enumeration.SeriesShape;
import java.util.List;

/**
 * Bucketed result of one path query.
 *
 * <p>The variant records how the path was classified by the schema probe; every later
 * stage (merge, derived statistics, unit conversion) reads the shape from here instead
 * of inspecting cell values.
 */
public sealed interface PathSeries permits ScalarSeries, CompositeSeries {

    PathSpec spec();

    List<BucketValue> buckets();

    SeriesShape shape();

    default boolean isEmpty() {
        return buckets().isEmpty();
    }
}
