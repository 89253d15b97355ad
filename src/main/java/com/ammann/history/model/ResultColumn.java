/* (C)2026 */
package com.ammann.history.model;

/**
 * One value column of a history result.
 *
 * @param name column name reported in {@code values}, e.g. {@code navigation.speedOverGround.ema}
 * @param method aggregation or derived statistic name
 * @param source series the column's cells come from
 */
public record ResultColumn(String name, String method, PathSeries source) {

    public static ResultColumn of(PathSeries series) {
        return new ResultColumn(
                series.spec().path(), series.spec().aggregateMethod().parameterName(), series);
    }

    public ResultColumn derived(String statistic) {
        return new ResultColumn(name + "." + statistic, statistic, source);
    }
}
