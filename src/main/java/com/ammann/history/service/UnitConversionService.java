/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.dto.FormattedValueDTO;
import com.ammann.history.dto.UnitInfoDTO;
import com.ammann.history.dto.UnitPreferenceDTO;
import com.ammann.history.dto.ValueDescriptorDTO;
import com.ammann.history.exception.ConversionProviderException;
import com.ammann.history.model.CompositeSeries;
import com.ammann.history.model.ConversionMetadata;
import com.ammann.history.model.HistoryTable;
import com.ammann.history.model.ResultColumn;
import com.ammann.history.model.ScalarSeries;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Converts numeric cells into each path's preferred unit.
 *
 * <p>The conversion table is loaded from the {@link UnitPreferenceProvider} on first use and
 * kept for {@code history.units.ttl}. An empty table is never kept, so the next request
 * asks again. When the provider is unavailable the failure is logged once, remembered for
 * the TTL, and values are returned unconverted.
 */
@ApplicationScoped
public class UnitConversionService {

    private static final Logger LOG = Logger.getLogger(UnitConversionService.class);

    static final String DEFAULT_DISPLAY_FORMAT = "0.00";
    private static final String FORMATTED_SUFFIX = "_formatted";

    @Inject UnitPreferenceProvider preferenceProvider;

    @Inject FormulaEvaluator formulaEvaluator;

    @Inject Clock clock;

    @ConfigProperty(name = "history.units.ttl", defaultValue = "5m")
    Duration ttl;

    private final AtomicBoolean unavailableLogged = new AtomicBoolean(false);
    private CachedTable cachedTable;

    /**
     * Result of the unit stage.
     *
     * @param table table with converted cells
     * @param values column descriptors with unit and display format where converted
     * @param units applied conversions by path; {@code null} when none applied
     */
    public record Result(HistoryTable table, List<ValueDescriptorDTO> values, Map<String, UnitInfoDTO> units) {}

    public Result apply(HistoryTable table, List<ValueDescriptorDTO> values) {
        Map<String, ConversionMetadata> conversions = conversions();
        if (conversions.isEmpty()) {
            return new Result(table, values, null);
        }

        List<ResultColumn> columns = table.columns();
        List<ConversionMetadata> columnConversions = new ArrayList<>();
        Map<String, UnitInfoDTO> units = new LinkedHashMap<>();
        List<ValueDescriptorDTO> descriptors = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            ConversionMetadata metadata = conversions.get(columns.get(i).source().spec().path());
            columnConversions.add(metadata);
            ValueDescriptorDTO descriptor = values.get(i);
            if (metadata == null) {
                descriptors.add(descriptor);
                continue;
            }
            descriptors.add(new ValueDescriptorDTO(
                    descriptor.path(), descriptor.method(), metadata.targetUnit(), metadata.displayFormat()));
            units.putIfAbsent(metadata.path(), new UnitInfoDTO(
                    metadata.baseUnit(), metadata.targetUnit(), metadata.symbol(),
                    metadata.displayFormat(), metadata.category()));
        }
        if (units.isEmpty()) {
            return new Result(table, values, null);
        }

        List<List<Object>> rows = new ArrayList<>(table.rows().size());
        for (List<Object> row : table.rows()) {
            List<Object> converted = new ArrayList<>(row.size());
            converted.add(row.get(0));
            for (int i = 0; i < columns.size(); i++) {
                converted.add(convertCell(row.get(i + 1), columns.get(i), columnConversions.get(i)));
            }
            rows.add(converted);
        }
        return new Result(new HistoryTable(columns, rows), descriptors, units);
    }

    /**
     * Current conversion table, loading it when missing or expired.
     */
    public synchronized Map<String, ConversionMetadata> conversions() {
        Instant now = clock.instant();
        if (cachedTable != null && Duration.between(cachedTable.loadedAt(), now).compareTo(ttl) < 0) {
            return cachedTable.entries();
        }
        cachedTable = null;
        Map<String, UnitPreferenceDTO> preferences;
        try {
            preferences = preferenceProvider.allConversions();
        } catch (ConversionProviderException e) {
            if (unavailableLogged.compareAndSet(false, true)) {
                LOG.warnf("Unit preferences unavailable, returning unconverted values: %s", e.getMessage());
            }
            cachedTable = new CachedTable(Map.of(), now);
            return cachedTable.entries();
        }
        unavailableLogged.set(false);

        Map<String, ConversionMetadata> entries = new LinkedHashMap<>();
        if (preferences != null) {
            preferences.forEach((path, preference) -> {
                ConversionMetadata metadata = toMetadata(path, preference);
                if (metadata != null) {
                    entries.put(path, metadata);
                }
            });
        }
        if (entries.isEmpty()) {
            LOG.debug("Unit preference provider returned no conversions yet");
            return Map.of();
        }
        cachedTable = new CachedTable(Map.copyOf(entries), now);
        LOG.infof("Loaded %d unit conversions", entries.size());
        return cachedTable.entries();
    }

    public synchronized void invalidate() {
        cachedTable = null;
    }

    /**
     * Applies a formula, returning the input when the formula fails or yields a non-finite
     * number.
     */
    double convert(double value, String formula) {
        try {
            double converted = formulaEvaluator.evaluate(formula, value);
            return Double.isFinite(converted) ? converted : value;
        } catch (IllegalArgumentException e) {
            LOG.debugf("Formula '%s' not applied: %s", formula, e.getMessage());
            return value;
        }
    }

    /**
     * Renders a value with the digits of {@code displayFormat}; {@code "0"} rounds to an
     * integer, {@code "0.0"} keeps one digit and so on.
     */
    static String format(double value, String displayFormat, String symbol) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        String pattern = displayFormat == null ? DEFAULT_DISPLAY_FORMAT : displayFormat;
        int dot = pattern.indexOf('.');
        int digits = dot < 0 ? 0 : pattern.length() - dot - 1;
        String text = BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).toPlainString();
        return symbol == null || symbol.isBlank() ? text : text + " " + symbol;
    }

    private Object convertCell(Object cell, ResultColumn column, ConversionMetadata metadata) {
        if (metadata == null || cell == null) {
            return cell;
        }
        if (column.source() instanceof ScalarSeries) {
            if (!DerivedStatisticsService.isFinite(cell)) {
                return cell;
            }
            double converted = convert(((Number) cell).doubleValue(), metadata.formula());
            return new FormattedValueDTO(converted, format(converted, metadata.displayFormat(), metadata.symbol()));
        }
        if (column.source() instanceof CompositeSeries composite && cell instanceof Map<?, ?> fields) {
            Map<String, Object> converted = new LinkedHashMap<>();
            for (Map.Entry<?, ?> field : fields.entrySet()) {
                String name = String.valueOf(field.getKey());
                Object value = field.getValue();
                if (DerivedStatisticsService.isFinite(value) && isConvertible(composite, name)) {
                    double result = convert(((Number) value).doubleValue(), metadata.formula());
                    converted.put(name, result);
                    if (composite.schema().isNumeric(name)) {
                        converted.put(name + FORMATTED_SUFFIX,
                                format(result, metadata.displayFormat(), metadata.symbol()));
                    }
                } else {
                    converted.put(name, value);
                }
            }
            return converted;
        }
        return cell;
    }

    private static boolean isConvertible(CompositeSeries series, String field) {
        if (series.schema().isNumeric(field)) {
            return true;
        }
        for (String suffix : List.of("_" + DerivedStatisticsService.EMA, "_" + DerivedStatisticsService.SMA)) {
            if (field.endsWith(suffix)
                    && series.schema().isNumeric(field.substring(0, field.length() - suffix.length()))) {
                return true;
            }
        }
        return false;
    }

    private static ConversionMetadata toMetadata(String path, UnitPreferenceDTO preference) {
        if (preference == null || preference.conversions() == null || preference.conversions().isEmpty()) {
            return null;
        }
        String target = preference.targetUnit() != null
                ? preference.targetUnit()
                : preference.conversions().keySet().iterator().next();
        UnitPreferenceDTO.ConversionDTO conversion = preference.conversions().get(target);
        if (conversion == null || conversion.formula() == null || conversion.formula().isBlank()) {
            return null;
        }
        String displayFormat = conversion.displayFormat() != null
                ? conversion.displayFormat()
                : preference.displayFormat() != null ? preference.displayFormat() : DEFAULT_DISPLAY_FORMAT;
        return new ConversionMetadata(
                path,
                preference.baseUnit(),
                target,
                conversion.formula(),
                conversion.inverseFormula(),
                conversion.symbol(),
                displayFormat,
                preference.category());
    }

    private record CachedTable(Map<String, ConversionMetadata> entries, Instant loadedAt) {}
}
