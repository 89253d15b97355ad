/* (C)2026 */
package com.ammann.history.model;

import com.ammann.history.enumeration.SeriesShape;
import java.util.List;

/**
 * Series of a path whose values are split across {@code value_*} sub-field columns.
 * Each bucket value is a map holding only the sub-fields that were non-null.
 */
public record CompositeSeries(PathSpec spec, ComponentSchema schema, List<BucketValue> buckets)
        implements PathSeries {

    public CompositeSeries {
        buckets = List.copyOf(buckets);
    }

    public static CompositeSeries empty(PathSpec spec, ComponentSchema schema) {
        return new CompositeSeries(spec, schema, List.of());
    }

    @Override
    public SeriesShape shape() {
        return SeriesShape.COMPOSITE;
    }
}
