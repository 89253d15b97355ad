/* (C)2026 */
package com.ammann.history.query;

import com.ammann.history.enumeration.AggregateMethod;
import com.ammann.history.model.TimeRange;
import com.ammann.history.util.TimeFormats;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds one grouped-by-bucket aggregation query over a set of Parquet files.
 *
 * <p>Every identifier is double-quoted with embedded quotes doubled, file locations are
 * rendered as escaped string literals, the bucket width is rendered from a {@code long} and
 * the time bounds are bound as parameters. Selected columns are added one by one, so a
 * schema-discovered column list of any length can be queried.
 *
 * <pre>{@code
 * PreparedQuery query = BucketQueryBuilder.over(List.of("/data/vessels/x/navigation/speed/*.parquet"))
 *         .resolution(60_000)
 *         .range(range)
 *         .aggregate("speed", AggregateMethod.AVERAGE, BucketQueryBuilder.numericValue("value"))
 *         .build();
 * }</pre>
 */
public final class BucketQueryBuilder {

    public static final String TIMESTAMP_COLUMN = "signalk_timestamp";
    public static final String BUCKET_ALIAS = "time_bucket";

    private final List<String> sources;
    private final List<SelectedColumn> columns = new ArrayList<>();
    private final List<String> presenceExpressions = new ArrayList<>();
    private String timestampColumn = TIMESTAMP_COLUMN;
    private Long resolutionMillis;
    private TimeRange range;

    private BucketQueryBuilder(List<String> sources) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("At least one Parquet source is required");
        }
        this.sources = List.copyOf(sources);
    }

    /**
     * Starts a query over file globs or file names, read with {@code union_by_name}.
     */
    public static BucketQueryBuilder over(List<String> sources) {
        return new BucketQueryBuilder(sources);
    }

    public BucketQueryBuilder timestampColumn(String column) {
        this.timestampColumn = Objects.requireNonNull(column, "column");
        return this;
    }

    public BucketQueryBuilder resolution(long millis) {
        if (millis <= 0) {
            throw new IllegalArgumentException("Resolution must be positive: " + millis);
        }
        this.resolutionMillis = millis;
        return this;
    }

    public BucketQueryBuilder range(TimeRange range) {
        this.range = Objects.requireNonNull(range, "range");
        return this;
    }

    /**
     * Selects {@code method} applied to {@code valueExpression} and requires that at least
     * one selected expression is non-null for a row to be counted.
     */
    public BucketQueryBuilder aggregate(String alias, AggregateMethod method, String valueExpression) {
        columns.add(new SelectedColumn(alias, aggregateExpression(method, valueExpression)));
        presenceExpressions.add(valueExpression);
        return this;
    }

    /**
     * Selects the earliest non-null value of {@code valueExpression} in each bucket.
     */
    public BucketQueryBuilder firstNonNull(String alias, String valueExpression) {
        return aggregate(alias, AggregateMethod.FIRST, valueExpression);
    }

    public PreparedQuery build() {
        if (resolutionMillis == null || range == null) {
            throw new IllegalStateException("Resolution and range are required");
        }
        if (columns.isEmpty()) {
            throw new IllegalStateException("At least one aggregate column is required");
        }
        String timestamp = timestampExpression();

        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append("CAST(floor(epoch_ms(").append(timestamp).append(") / ")
                .append(resolutionMillis).append(".0) AS BIGINT) * ").append(resolutionMillis)
                .append(" AS ").append(quoteIdentifier(BUCKET_ALIAS));
        for (SelectedColumn column : columns) {
            sql.append(", ").append(column.expression())
                    .append(" AS ").append(quoteIdentifier(column.alias()));
        }
        sql.append(" FROM ").append(source());
        sql.append(" WHERE ").append(timestamp).append(" >= CAST(? AS TIMESTAMP)");
        sql.append(" AND ").append(timestamp).append(" < CAST(? AS TIMESTAMP)");
        sql.append(" AND (")
                .append(presenceExpressions.stream()
                        .distinct()
                        .map(e -> e + " IS NOT NULL")
                        .collect(Collectors.joining(" OR ")))
                .append(")");
        sql.append(" GROUP BY ").append(quoteIdentifier(BUCKET_ALIAS));
        sql.append(" ORDER BY ").append(quoteIdentifier(BUCKET_ALIAS));

        List<Object> parameters =
                List.of(TimeFormats.sqlTimestamp(range.from()), TimeFormats.sqlTimestamp(range.to()));
        return new PreparedQuery(sql.toString(), parameters);
    }

    /**
     * {@code TRY_CAST} of a column to {@code DOUBLE}; non-numeric values become null.
     */
    public static String numericValue(String column) {
        return "TRY_CAST(" + quoteIdentifier(column) + " AS DOUBLE)";
    }

    public static String column(String column) {
        return quoteIdentifier(column);
    }

    /**
     * {@code read_parquet} table function over the given sources.
     */
    public static String readParquet(List<String> sources) {
        String files = sources.size() == 1
                ? quoteLiteral(sources.get(0))
                : sources.stream().map(BucketQueryBuilder::quoteLiteral)
                        .collect(Collectors.joining(", ", "[", "]"));
        return "read_parquet(" + files + ", union_by_name = true)";
    }

    public static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String quoteLiteral(String literal) {
        return "'" + literal.replace("'", "''") + "'";
    }

    private String aggregateExpression(AggregateMethod method, String value) {
        String timestamp = timestampExpression();
        String nonNull = " FILTER (WHERE " + value + " IS NOT NULL)";
        return switch (method) {
            case AVERAGE, MIN, MAX, MID -> method.functionName() + "(" + value + ")";
            case FIRST -> "arg_min(" + value + ", " + timestamp + ")" + nonNull;
            case LAST -> "arg_max(" + value + ", " + timestamp + ")" + nonNull;
            case MIDDLE_INDEX -> "coalesce(list_extract(list(" + value + " ORDER BY " + timestamp
                    + ")" + nonNull + ", CAST((count(" + value + ") + 1) // 2 AS BIGINT)), "
                    + "arg_min(" + value + ", " + timestamp + ")" + nonNull + ")";
        };
    }

    private String timestampExpression() {
        return "CAST(" + quoteIdentifier(timestampColumn) + " AS TIMESTAMP)";
    }

    private String source() {
        return readParquet(sources);
    }

    private record SelectedColumn(String alias, String expression) {}
}
