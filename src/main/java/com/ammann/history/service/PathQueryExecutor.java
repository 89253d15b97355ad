/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.enumeration.AggregateMethod;
import com.ammann.history.exception.QueryCancelledException;
import com.ammann.history.model.BucketValue;
import com.ammann.history.model.ComponentInfo;
import com.ammann.history.model.ComponentSchema;
import com.ammann.history.model.CompositeSeries;
import com.ammann.history.model.PathSeries;
import com.ammann.history.model.PathSpec;
import com.ammann.history.model.ScalarSeries;
import com.ammann.history.model.TimeRange;
import com.ammann.history.query.BucketQueryBuilder;
import com.ammann.history.query.PreparedQuery;
import com.ammann.history.query.QueryCancellation;
import com.ammann.history.store.DuckDbConnectionProvider;
import com.ammann.history.store.StoreLayout;
import com.ammann.history.util.TimeFormats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/**
 * Runs the bucketed aggregation query of one path.
 *
 * <p>The path is classified once through {@link SchemaProbeService}: composite paths
 * aggregate every declared sub-field, scalar paths aggregate the numeric {@code value}
 * column and fall back to the structured {@code value_json} column. Any failure other than
 * cancellation is logged and yields an empty series so the rest of the request survives.
 */
@ApplicationScoped
public class PathQueryExecutor {

    private static final Logger LOG = Logger.getLogger(PathQueryExecutor.class);

    static final String JSON_COLUMN = "value_json";
    private static final String VALUE_ALIAS = "agg_value";
    private static final String JSON_ALIAS = "agg_json";

    @Inject DuckDbConnectionProvider connectionProvider;

    @Inject StoreLayout storeLayout;

    @Inject SchemaProbeService schemaProbe;

    @Inject ObjectMapper objectMapper;

    @Inject MeterRegistry meterRegistry;

    private Timer queryTimer;
    private Counter failureCounter;

    /**
     * Queries one path.
     *
     * @return the series, empty when the path has no data or its query failed
     * @throws QueryCancelledException when the request was cancelled
     */
    public PathSeries execute(
            String context,
            PathSpec spec,
            TimeRange range,
            long resolutionMillis,
            QueryCancellation cancellation) {
        initMetrics();
        long started = System.nanoTime();
        ComponentSchema schema = ComponentSchema.EMPTY;
        try {
            cancellation.throwIfCancelled();
            Optional<Path> directory = storeLayout.pathDirectory(context, spec.path());
            if (directory.isEmpty()) {
                LOG.warnf("Rejected path '%s' for context %s", spec.path(), context);
                return ScalarSeries.empty(spec);
            }
            List<Path> files = storeLayout.parquetFiles(directory.get());
            if (files.isEmpty()) {
                LOG.debugf("No data files for %s in %s", spec.path(), context);
                return ScalarSeries.empty(spec);
            }

            schema = schemaProbe.probe(context, spec.path());
            List<String> sources = files.stream().map(Path::toString).toList();
            cancellation.throwIfCancelled();

            try (Connection connection = connectionProvider.openConnection()) {
                PathSeries series = schema.isComposite()
                        ? queryComposite(connection, spec, schema, sources, range, resolutionMillis, cancellation)
                        : queryScalar(connection, spec, sources, range, resolutionMillis, cancellation);
                LOG.debugf("Path %s (%s) returned %d buckets",
                        spec.path(), series.shape(), series.buckets().size());
                return series;
            }
        } catch (QueryCancelledException e) {
            throw e;
        } catch (SQLException e) {
            if (cancellation.isCancelled()) {
                throw new QueryCancelledException("Query of path " + spec.path() + " was cancelled");
            }
            return failed(spec, schema, e);
        } catch (RuntimeException e) {
            return failed(spec, schema, e);
        } finally {
            if (queryTimer != null) {
                queryTimer.record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
            }
        }
    }

    private PathSeries queryComposite(
            Connection connection,
            PathSpec spec,
            ComponentSchema schema,
            List<String> sources,
            TimeRange range,
            long resolutionMillis,
            QueryCancellation cancellation) throws SQLException {
        BucketQueryBuilder builder = BucketQueryBuilder.over(sources).resolution(resolutionMillis).range(range);
        List<ComponentInfo> components = new ArrayList<>(schema.components().values());
        for (ComponentInfo component : components) {
            AggregateMethod method = spec.aggregateMethod().forComponent(component.dataType());
            String expression = component.isNumeric()
                    ? BucketQueryBuilder.numericValue(component.columnName())
                    : BucketQueryBuilder.column(component.columnName());
            builder.aggregate(component.columnName(), method, expression);
        }

        List<BucketValue> buckets = new ArrayList<>();
        run(connection, builder.build(), cancellation, resultSet -> {
            Map<String, Object> value = new LinkedHashMap<>();
            for (ComponentInfo component : components) {
                Object cell = resultSet.getObject(component.columnName());
                if (cell == null) {
                    continue;
                }
                value.put(component.name(), cell instanceof Number number && component.isNumeric()
                        ? (Object) number.doubleValue()
                        : cell);
            }
            if (!value.isEmpty()) {
                buckets.add(new BucketValue(bucketTimestamp(resultSet), value));
            }
        });
        return new CompositeSeries(spec, schema, buckets);
    }

    private PathSeries queryScalar(
            Connection connection,
            PathSpec spec,
            List<String> sources,
            TimeRange range,
            long resolutionMillis,
            QueryCancellation cancellation) throws SQLException {
        Set<String> columns = describe(connection, sources);
        boolean hasValue = columns.contains(SchemaProbeService.VALUE_COLUMN);
        boolean hasJson = columns.contains(JSON_COLUMN);
        if (!hasValue && !hasJson) {
            LOG.debugf("Path %s has neither value nor %s column", spec.path(), JSON_COLUMN);
            return ScalarSeries.empty(spec);
        }

        BucketQueryBuilder builder = BucketQueryBuilder.over(sources).resolution(resolutionMillis).range(range);
        if (hasValue) {
            builder.aggregate(VALUE_ALIAS, spec.aggregateMethod(),
                    BucketQueryBuilder.numericValue(SchemaProbeService.VALUE_COLUMN));
        }
        if (hasJson) {
            builder.firstNonNull(JSON_ALIAS, BucketQueryBuilder.column(JSON_COLUMN));
        }

        List<BucketValue> buckets = new ArrayList<>();
        run(connection, builder.build(), cancellation, resultSet -> {
            Object value = hasJson ? parseJson(spec, resultSet.getString(JSON_ALIAS)) : null;
            if (value == null && hasValue) {
                Object number = resultSet.getObject(VALUE_ALIAS);
                value = number instanceof Number n ? (Object) n.doubleValue() : null;
            }
            if (value != null) {
                buckets.add(new BucketValue(bucketTimestamp(resultSet), value));
            }
        });
        return new ScalarSeries(spec, buckets);
    }

    private Set<String> describe(Connection connection, List<String> sources) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement statement = connection.createStatement();
                ResultSet resultSet = statement.executeQuery(
                        "DESCRIBE SELECT * FROM " + BucketQueryBuilder.readParquet(sources))) {
            while (resultSet.next()) {
                columns.add(resultSet.getString("column_name"));
            }
        }
        return columns;
    }

    private void run(
            Connection connection,
            PreparedQuery query,
            QueryCancellation cancellation,
            RowHandler handler) throws SQLException {
        LOG.debugf("Executing %s", query.sql());
        try (PreparedStatement statement = connection.prepareStatement(query.sql())) {
            query.bind(statement);
            cancellation.register(statement);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    handler.handle(resultSet);
                }
            } finally {
                cancellation.unregister(statement);
            }
        }
    }

    private Object parseJson(PathSpec spec, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            LOG.debugf("Ignoring malformed %s of %s: %s", JSON_COLUMN, spec.path(), e.getOriginalMessage());
            return null;
        }
    }

    private static String bucketTimestamp(ResultSet resultSet) throws SQLException {
        return TimeFormats.utcFromEpochMillis(resultSet.getLong(BucketQueryBuilder.BUCKET_ALIAS));
    }

    private PathSeries failed(PathSpec spec, ComponentSchema schema, Exception e) {
        LOG.warnf("Query for path %s failed, returning empty series: %s", spec.path(), e.getMessage());
        if (failureCounter != null) {
            failureCounter.increment();
        }
        return schema.isComposite() ? CompositeSeries.empty(spec, schema) : ScalarSeries.empty(spec);
    }

    void initMetrics() {
        if (meterRegistry != null && queryTimer == null) {
            queryTimer = Timer.builder("history_path_query_duration_seconds")
                    .description("Duration of single-path history queries")
                    .register(meterRegistry);
            failureCounter = Counter.builder("history_path_query_failures_total")
                    .description("Path queries that failed and returned an empty series")
                    .register(meterRegistry);
        }
    }

    @FunctionalInterface
    private interface RowHandler {
        void handle(ResultSet resultSet) throws SQLException;
    }
}
