/* (C)2026 */
package com.ammann.history.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * Unit preference entry for one path as supplied by the unit preference provider.
 *
 * @param baseUnit unit of the stored values
 * @param category unit category
 * @param targetUnit preferred target unit; the first conversion is used when absent
 * @param displayFormat default display format for the path
 * @param conversions available conversions by target unit
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UnitPreferenceDTO(
        String baseUnit,
        String category,
        String targetUnit,
        String displayFormat,
        Map<String, ConversionDTO> conversions) {

    /**
     * One conversion from the base unit to a target unit.
     *
     * @param formula expression over {@code value} (or {@code x}) giving the target value
     * @param inverseFormula expression converting back to the base unit
     * @param symbol display symbol
     * @param displayFormat display format overriding the path default
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConversionDTO(
            String formula, String inverseFormula, String symbol, String displayFormat) {}
}
