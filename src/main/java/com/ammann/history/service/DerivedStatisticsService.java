/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.model.CompositeSeries;
import com.ammann.history.model.HistoryTable;
import com.ammann.history.model.ResultColumn;
import com.ammann.history.model.ScalarSeries;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds exponential and simple moving averages to merged rows in one pass.
 *
 * <p>Scalar columns gain two cells, EMA then SMA, right after the raw value and two
 * matching {@code .ema}/{@code .sma} columns. Composite columns keep one cell; each numeric
 * sub-field gets {@code <field>_ema} and {@code <field>_sma} entries inside the object.
 * Missing, non-numeric or non-finite samples leave the running state untouched and produce no derived
 * value.
 */
@ApplicationScoped
public class DerivedStatisticsService {

    static final double EMA_ALPHA = 0.2;
    static final int SMA_WINDOW = 10;

    public static final String EMA = "ema";
    public static final String SMA = "sma";

    public HistoryTable apply(HistoryTable table) {
        List<ResultColumn> sourceColumns = table.columns();
        List<ResultColumn> columns = new ArrayList<>();
        for (ResultColumn column : sourceColumns) {
            columns.add(column);
            if (column.source() instanceof ScalarSeries) {
                columns.add(column.derived(EMA));
                columns.add(column.derived(SMA));
            }
        }

        List<RunningAverage> scalarState = new ArrayList<>();
        List<Map<String, RunningAverage>> compositeState = new ArrayList<>();
        for (int i = 0; i < sourceColumns.size(); i++) {
            scalarState.add(new RunningAverage());
            compositeState.add(new HashMap<>());
        }

        List<List<Object>> rows = new ArrayList<>(table.rows().size());
        for (List<Object> row : table.rows()) {
            List<Object> expanded = new ArrayList<>(columns.size() + 1);
            expanded.add(row.get(0));
            for (int i = 0; i < sourceColumns.size(); i++) {
                Object cell = row.get(i + 1);
                if (sourceColumns.get(i).source() instanceof CompositeSeries composite) {
                    expanded.add(withComponentAverages(cell, composite, compositeState.get(i)));
                } else {
                    expanded.add(cell);
                    RunningAverage state = scalarState.get(i);
                    if (isFinite(cell)) {
                        state.add(((Number) cell).doubleValue());
                        expanded.add(round(state.ema()));
                        expanded.add(round(state.sma()));
                    } else {
                        expanded.add(null);
                        expanded.add(null);
                    }
                }
            }
            rows.add(expanded);
        }
        return new HistoryTable(columns, rows);
    }

    private Object withComponentAverages(
            Object cell, CompositeSeries series, Map<String, RunningAverage> state) {
        if (!(cell instanceof Map<?, ?> fields)) {
            return cell;
        }
        Map<String, Object> enriched = new LinkedHashMap<>();
        for (Map.Entry<?, ?> field : fields.entrySet()) {
            String name = String.valueOf(field.getKey());
            enriched.put(name, field.getValue());
            if (series.schema().isNumeric(name) && isFinite(field.getValue())) {
                RunningAverage average = state.computeIfAbsent(name, n -> new RunningAverage());
                average.add(((Number) field.getValue()).doubleValue());
                enriched.put(name + "_" + EMA, round(average.ema()));
                enriched.put(name + "_" + SMA, round(average.sma()));
            }
        }
        return enriched;
    }

    /** NaN and infinities count as missing samples. */
    static boolean isFinite(Object value) {
        return value instanceof Number number && Double.isFinite(number.doubleValue());
    }

    static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    /** EMA and trailing-window SMA state of one numeric stream. */
    static final class RunningAverage {
        private Double ema;
        private final Deque<Double> window = new ArrayDeque<>();

        void add(double value) {
            ema = ema == null ? value : EMA_ALPHA * value + (1 - EMA_ALPHA) * ema;
            window.addLast(value);
            if (window.size() > SMA_WINDOW) {
                window.removeFirst();
            }
        }

        double ema() {
            return ema;
        }

        double sma() {
            return window.stream().mapToDouble(Double::doubleValue).sum() / window.size();
        }
    }
}
