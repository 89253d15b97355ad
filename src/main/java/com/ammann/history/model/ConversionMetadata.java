/* (C)2026 */
package com.ammann.history.model;

/**
 * Resolved unit conversion for one path.
 */
public record ConversionMetadata(
        String path,
        String baseUnit,
        String targetUnit,
        String formula,
        String inverseFormula,
        String symbol,
        String displayFormat,
        String category) {}
