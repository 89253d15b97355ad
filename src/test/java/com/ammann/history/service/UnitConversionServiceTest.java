/* (C)2026 */
package com.ammann.history.service;

import static com.ammann.history.support.SeriesFixtures.asFields;
import static com.ammann.history.support.SeriesFixtures.composite;
import static com.ammann.history.support.SeriesFixtures.fields;
import static com.ammann.history.support.SeriesFixtures.minute;
import static com.ammann.history.support.SeriesFixtures.scalar;
import static com.ammann.history.support.SeriesFixtures.schema;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.history.dto.FormattedValueDTO;
import com.ammann.history.dto.UnitPreferenceDTO;
import com.ammann.history.dto.UnitPreferenceDTO.ConversionDTO;
import com.ammann.history.dto.ValueDescriptorDTO;
import com.ammann.history.enumeration.ComponentDataType;
import com.ammann.history.exception.ConversionProviderException;
import com.ammann.history.model.BucketValue;
import com.ammann.history.model.HistoryTable;
import com.ammann.history.support.MutableClock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UnitConversionServiceTest {

    private static final String SOG = "navigation.speedOverGround";

    private UnitPreferenceProvider provider;
    private MutableClock clock;
    private UnitConversionService service;

    @BeforeEach
    void setUp() {
        provider = mock(UnitPreferenceProvider.class);
        clock = MutableClock.at("2025-08-11T10:00:00Z");
        service = new UnitConversionService();
        service.preferenceProvider = provider;
        service.formulaEvaluator = new FormulaEvaluator();
        service.clock = clock;
        service.ttl = Duration.ofMinutes(5);
    }

    private static Map<String, UnitPreferenceDTO> knots() {
        Map<String, ConversionDTO> conversions = new LinkedHashMap<>();
        conversions.put("km/h", new ConversionDTO("value * 3.6", "value / 3.6", "km/h", null));
        conversions.put("kn", new ConversionDTO("value * 1.94384", "value * 0.514444", "kn", "0.0"));
        return Map.of(SOG, new UnitPreferenceDTO("m/s", "speed", "kn", null, conversions));
    }

    private static List<ValueDescriptorDTO> descriptors(HistoryTable table) {
        return table.columns().stream().map(c -> ValueDescriptorDTO.of(c.name(), c.method())).toList();
    }

    @Test
    void scalarCellsBecomeFormattedValues() {
        when(provider.allConversions()).thenReturn(knots());
        HistoryTable table = new SeriesMerger().merge(List.of(scalar(SOG, 3.2, null), scalar("environment.depth", 4.0, 5.0)));

        UnitConversionService.Result result = service.apply(table, descriptors(table));

        Object converted = result.table().rows().get(0).get(1);
        assertThat(converted).isInstanceOf(FormattedValueDTO.class);
        FormattedValueDTO formatted = (FormattedValueDTO) converted;
        assertThat(formatted.value()).isCloseTo(6.220288, within(1e-6));
        assertThat(formatted.formatted()).isEqualTo("6.2 kn");
        assertThat(result.table().rows().get(1).get(1)).isNull();
        assertThat(result.table().rows().get(0).get(2)).isEqualTo(4.0);

        assertThat(result.values().get(0)).isEqualTo(new ValueDescriptorDTO(SOG, "average", "kn", "0.0"));
        assertThat(result.values().get(1).unit()).isNull();
        assertThat(result.units()).containsOnlyKeys(SOG);
        assertThat(result.units().get(SOG).symbol()).isEqualTo("kn");
        assertThat(result.units().get(SOG).baseUnit()).isEqualTo("m/s");
    }

    @Test
    void derivedColumnsOfAConvertedPathAreConvertedToo() {
        when(provider.allConversions()).thenReturn(knots());
        HistoryTable table = new DerivedStatisticsService().apply(new SeriesMerger().merge(List.of(scalar(SOG, 1.0))));

        UnitConversionService.Result result = service.apply(table, descriptors(table));

        assertThat(result.table().rows().get(0).subList(1, 4))
                .allSatisfy(cell -> assertThat(((FormattedValueDTO) cell).formatted()).isEqualTo("1.9 kn"));
        assertThat(result.values()).extracting(ValueDescriptorDTO::unit).containsExactly("kn", "kn", "kn");
    }

    @Test
    void compositeNumericFieldsAreConvertedAndFormatted() {
        Map<String, ConversionDTO> conversions = Map.of("C", new ConversionDTO("value - 273.15", null, "°C", null));
        when(provider.allConversions()).thenReturn(Map.of("environment.outside",
                new UnitPreferenceDTO("K", "temperature", null, "0", conversions)));
        HistoryTable table = new DerivedStatisticsService().apply(new SeriesMerger().merge(List.of(composite(
                "environment.outside",
                schema("temperature", ComponentDataType.NUMERIC, "sensor", ComponentDataType.STRING),
                List.of(new BucketValue(minute(0), fields("temperature", 300.0, "sensor", "deck")))))));

        UnitConversionService.Result result = service.apply(table, descriptors(table));

        Map<String, Object> cell = asFields(result.table().rows().get(0).get(1));
        assertThat((Double) cell.get("temperature")).isCloseTo(26.85, within(1e-9));
        assertThat(cell.get("temperature_formatted")).isEqualTo("27 °C");
        assertThat((Double) cell.get("temperature_ema")).isCloseTo(26.85, within(1e-9));
        assertThat(cell).containsEntry("sensor", "deck").doesNotContainKey("temperature_ema_formatted");
        assertThat(result.values().get(0).displayFormat()).isEqualTo("0");
    }

    @Test
    void unavailableProviderLeavesValuesUntouchedAndIsAskedAgainAfterTtl() {
        when(provider.allConversions()).thenThrow(new ConversionProviderException("down"));
        HistoryTable table = new SeriesMerger().merge(List.of(scalar(SOG, 3.2)));

        UnitConversionService.Result first = service.apply(table, descriptors(table));
        service.apply(table, descriptors(table));

        assertThat(first.table()).isSameAs(table);
        assertThat(first.units()).isNull();
        verify(provider, times(1)).allConversions();

        clock.advance(Duration.ofMinutes(6));
        service.apply(table, descriptors(table));
        verify(provider, times(2)).allConversions();
    }

    @Test
    void emptyTableIsNotCached() {
        when(provider.allConversions()).thenReturn(Map.of()).thenReturn(knots());

        assertThat(service.conversions()).isEmpty();
        assertThat(service.conversions()).containsOnlyKeys(SOG);
        service.conversions();

        verify(provider, times(2)).allConversions();
    }

    @Test
    void loadedTableIsKeptForTtlAndDroppedOnInvalidate() {
        when(provider.allConversions()).thenReturn(knots());

        service.conversions();
        clock.advance(Duration.ofMinutes(4));
        service.conversions();
        verify(provider, times(1)).allConversions();

        service.invalidate();
        service.conversions();
        verify(provider, times(2)).allConversions();
    }

    @Test
    void targetUnitDefaultsToFirstConversion() {
        Map<String, ConversionDTO> conversions = new LinkedHashMap<>();
        conversions.put("km/h", new ConversionDTO("value * 3.6", null, "km/h", null));
        conversions.put("kn", new ConversionDTO("value * 1.94384", null, "kn", null));
        when(provider.allConversions()).thenReturn(Map.of(SOG, new UnitPreferenceDTO("m/s", "speed", null, null, conversions)));

        assertThat(service.conversions().get(SOG).targetUnit()).isEqualTo("km/h");
        assertThat(service.conversions().get(SOG).displayFormat()).isEqualTo("0.00");
    }

    @Test
    void failingFormulaReturnsTheInput() {
        assertThat(service.convert(2.0, "value ^ 2")).isEqualTo(2.0);
        assertThat(service.convert(2.0, "value / 0")).isEqualTo(2.0);
        assertThat(service.convert(2.0, "value * 2")).isEqualTo(4.0);
    }

    @Test
    void formatUsesDigitsOfDisplayFormat() {
        assertThat(UnitConversionService.format(6.25, "0.0", "kn")).isEqualTo("6.3 kn");
        assertThat(UnitConversionService.format(26.5, "0", "°C")).isEqualTo("27 °C");
        assertThat(UnitConversionService.format(1.0, null, null)).isEqualTo("1.00");
        assertThat(UnitConversionService.format(1.23456, "0.000", " ")).isEqualTo("1.235");
    }

    @Test
    void nonFiniteValuesAreLeftUnconverted() {
        Map<String, ConversionDTO> conversions = Map.of("kn", new ConversionDTO("value * 1.94384", null, "kn", "0.0"));
        when(provider.allConversions()).thenReturn(Map.of(
                SOG, new UnitPreferenceDTO("m/s", "speed", "kn", null, conversions),
                "environment.wind", new UnitPreferenceDTO("m/s", "speed", "kn", null, conversions)));
        HistoryTable table = new SeriesMerger().merge(List.of(
                scalar(SOG, Double.NaN, 2.0),
                composite("environment.wind",
                        schema("speed", ComponentDataType.NUMERIC),
                        List.of(new BucketValue(minute(0), fields("speed", Double.POSITIVE_INFINITY))))));

        UnitConversionService.Result result = service.apply(table, descriptors(table));

        List<Object> first = result.table().rows().get(0);
        assertThat(first.get(1)).isInstanceOf(Double.class);
        assertThat((Double) first.get(1)).isNaN();
        assertThat(asFields(first.get(2)))
                .containsEntry("speed", Double.POSITIVE_INFINITY)
                .doesNotContainKey("speed_formatted");
        assertThat(((FormattedValueDTO) result.table().rows().get(1).get(1)).formatted()).isEqualTo("3.9 kn");
    }

    @Test
    void formatRendersNonFiniteValuesVerbatim() {
        assertThat(UnitConversionService.format(Double.NaN, "0.0", "kn")).isEqualTo("NaN kn");
        assertThat(UnitConversionService.format(Double.NEGATIVE_INFINITY, null, null)).isEqualTo("-Infinity");
    }
}
