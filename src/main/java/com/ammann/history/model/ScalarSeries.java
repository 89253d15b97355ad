/* (C)2026 */
package com.ammann.history.model;

import com.ammann.history.enumeration.SeriesShape;
import java.util.List;

/**
 * Series of a path stored as a single value column.
 */
public record ScalarSeries(PathSpec spec, List<BucketValue> buckets) implements PathSeries {

    public ScalarSeries {
        buckets = List.copyOf(buckets);
    }

    public static ScalarSeries empty(PathSpec spec) {
        return new ScalarSeries(spec, List.of());
    }

    @Override
    public SeriesShape shape() {
        return SeriesShape.SCALAR;
    }
}
