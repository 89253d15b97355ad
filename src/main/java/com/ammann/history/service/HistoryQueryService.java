/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.dto.HistoryValuesResponseDTO;
import com.ammann.history.dto.RangeDTO;
import com.ammann.history.dto.TimezoneInfoDTO;
import com.ammann.history.dto.UnitInfoDTO;
import com.ammann.history.dto.ValueDescriptorDTO;
import com.ammann.history.exception.QueryCancelledException;
import com.ammann.history.exception.QueryTimeoutException;
import com.ammann.history.model.HistoryQuery;
import com.ammann.history.model.HistoryTable;
import com.ammann.history.model.PathSeries;
import com.ammann.history.model.PathSpec;
import com.ammann.history.query.QueryCancellation;
import com.ammann.history.util.TimeFormats;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Runs a history values request: one query per path in parallel, then merge and the
 * optional moving average, unit and timezone stages.
 *
 * <p>The merge waits for every path query. A failed path contributes an empty series, but
 * a cancelled or timed-out request fails as a whole and never returns partial rows.
 */
@ApplicationScoped
public class HistoryQueryService {

    private static final Logger LOG = Logger.getLogger(HistoryQueryService.class);

    @Inject PathQueryExecutor pathQueryExecutor;

    @Inject
    @Named("history-query-executor")
    ExecutorService executor;

    @Inject SeriesMerger seriesMerger;

    @Inject DerivedStatisticsService derivedStatisticsService;

    @Inject UnitConversionService unitConversionService;

    @Inject TimezoneConversionService timezoneConversionService;

    @ConfigProperty(name = "history.query.timeout", defaultValue = "30s")
    Duration queryTimeout;

    public HistoryValuesResponseDTO getValues(HistoryQuery query, QueryCancellation cancellation) {
        cancellation.throwIfCancelled();
        long started = System.currentTimeMillis();

        List<PathSeries> series = queryAllPaths(query, cancellation);
        HistoryTable table = seriesMerger.merge(series);

        if (query.includeMovingAverages()) {
            table = derivedStatisticsService.apply(table);
        }

        List<ValueDescriptorDTO> values = table.columns().stream()
                .map(column -> ValueDescriptorDTO.of(column.name(), column.method()))
                .toList();
        Map<String, UnitInfoDTO> units = null;
        if (query.convertUnits()) {
            UnitConversionService.Result converted = unitConversionService.apply(table, values);
            table = converted.table();
            values = converted.values();
            units = converted.units();
        }

        List<List<Object>> rows = table.rows();
        RangeDTO range = new RangeDTO(TimeFormats.utc(query.range().from()), TimeFormats.utc(query.range().to()));
        TimezoneInfoDTO timezone = null;
        if (query.convertTimesToLocal()) {
            TimezoneConversionService.Result converted =
                    timezoneConversionService.apply(rows, query.range(), query.timezone());
            rows = converted.rows();
            range = converted.range();
            timezone = converted.timezone();
        }

        LOG.infof("History query for %s: %d paths, %d rows in %d ms",
                query.context(), query.pathSpecs().size(), rows.size(), System.currentTimeMillis() - started);
        return new HistoryValuesResponseDTO(query.context(), range, values, rows, units, timezone, null);
    }

    private List<PathSeries> queryAllPaths(HistoryQuery query, QueryCancellation cancellation) {
        List<CompletableFuture<PathSeries>> futures = new ArrayList<>();
        for (PathSpec spec : query.pathSpecs()) {
            futures.add(CompletableFuture.supplyAsync(() -> queryPath(query, spec, cancellation), executor));
        }
        cancellation.onCancel(() -> futures.forEach(future -> future.cancel(true)));

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                    .get(queryTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            int pending = (int) futures.stream().filter(future -> !future.isDone()).count();
            cancellation.cancel();
            throw new QueryTimeoutException(queryTimeout, pending);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            throw new QueryCancelledException("History query was interrupted");
        } catch (CancellationException e) {
            cancellation.cancel();
            throw new QueryCancelledException("History query was cancelled");
        } catch (ExecutionException e) {
            cancellation.cancel();
            Throwable cause = e.getCause();
            if (cause instanceof QueryCancelledException cancelled) {
                throw cancelled;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("History query failed", cause);
        }

        cancellation.throwIfCancelled();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    /** Per-path failures are absorbed by {@link PathQueryExecutor}; anything escaping it fails the request. */
    private PathSeries queryPath(HistoryQuery query, PathSpec spec, QueryCancellation cancellation) {
        cancellation.throwIfCancelled();
        return pathQueryExecutor.execute(
                query.context(), spec, query.range(), query.resolutionMillis(), cancellation);
    }
}
