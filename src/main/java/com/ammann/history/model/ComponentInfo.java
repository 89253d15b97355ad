/* (C)2026 */
package com.ammann.history.model;

import com.ammann.history.enumeration.ComponentDataType;

/**
 * Declared sub-field of a composite path.
 *
 * @param name sub-field name, e.g. {@code latitude}
 * @param columnName store column holding it, e.g. {@code value_latitude}
 * @param dataType declared type category
 */
public record ComponentInfo(String name, String columnName, ComponentDataType dataType) {

    public boolean isNumeric() {
        return dataType == ComponentDataType.NUMERIC;
    }
}
