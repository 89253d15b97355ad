/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.model.BucketValue;
import com.ammann.history.model.HistoryTable;
import com.ammann.history.model.PathSeries;
import com.ammann.history.model.ResultColumn;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aligns per-path series into rows keyed by bucket timestamp.
 *
 * <p>Bucket timestamps share one fixed-width UTC rendering, so ordering the row map by
 * its string key orders the rows chronologically.
 */
@ApplicationScoped
public class SeriesMerger {

    /**
     * Merges series into a table with one column per series, in the given order.
     */
    public HistoryTable merge(List<PathSeries> series) {
        List<ResultColumn> columns = series.stream().map(ResultColumn::of).toList();
        Map<String, List<Object>> rows = new TreeMap<>();

        for (int column = 0; column < series.size(); column++) {
            for (BucketValue bucket : series.get(column).buckets()) {
                List<Object> row = rows.computeIfAbsent(bucket.timestamp(), ts -> newRow(ts, series.size()));
                row.set(column + 1, bucket.value());
            }
        }
        return new HistoryTable(columns, new ArrayList<>(rows.values()));
    }

    private static List<Object> newRow(String timestamp, int cells) {
        List<Object> row = new ArrayList<>(Collections.nCopies(cells + 1, null));
        row.set(0, timestamp);
        return row;
    }
}
