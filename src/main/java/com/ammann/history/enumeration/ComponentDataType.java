/* (C)2026 */
package com.ammann.history.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Declared type category of a composite sub-field column.
 */
public enum ComponentDataType {
    NUMERIC("numeric"),
    STRING("string"),
    BOOLEAN("boolean"),
    UNKNOWN("unknown");

    private final String label;

    ComponentDataType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Classifies a Parquet/DuckDB column type.
     *
     * @param physicalType physical or logical type name, e.g. {@code DOUBLE}, {@code INT64}
     * @param convertedType Parquet converted type, e.g. {@code UTF8}; may be {@code null}
     */
    public static ComponentDataType fromColumnType(String physicalType, String convertedType) {
        String type = physicalType == null ? "" : physicalType.toUpperCase(Locale.ROOT);
        String converted = convertedType == null ? "" : convertedType.toUpperCase(Locale.ROOT);

        if (converted.contains("UTF8") || converted.contains("ENUM") || converted.contains("JSON")) {
            return STRING;
        }
        if (converted.contains("DECIMAL") || converted.startsWith("INT_") || converted.startsWith("UINT_")) {
            return NUMERIC;
        }
        if (type.contains("INT")
                || type.contains("DOUBLE")
                || type.contains("FLOAT")
                || type.contains("DECIMAL")
                || type.contains("NUMERIC")
                || type.contains("REAL")) {
            return NUMERIC;
        }
        if (type.contains("VARCHAR")
                || type.contains("CHAR")
                || type.contains("TEXT")
                || type.contains("STRING")
                || type.contains("UTF8")) {
            return STRING;
        }
        if (type.contains("BOOL")) {
            return BOOLEAN;
        }
        return UNKNOWN;
    }
}
