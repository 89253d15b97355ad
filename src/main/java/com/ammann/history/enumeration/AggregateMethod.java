/* (C)2026 */
package com.ammann.history.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * Aggregation applied to all samples of a path that fall into one bucket.
 *
 * <p>Each constant carries the name accepted in the {@code paths} query parameter and
 * the name of the aggregate function it maps to.
 */
public enum AggregateMethod {
    AVERAGE("average", "avg"),
    MIN("min", "min"),
    MAX("max", "max"),
    FIRST("first", "first"),
    LAST("last", "last"),
    MID("mid", "median"),
    MIDDLE_INDEX("middle_index", "nth_value");

    private final String parameterName;
    private final String functionName;

    AggregateMethod(String parameterName, String functionName) {
        this.parameterName = parameterName;
        this.functionName = functionName;
    }

    @JsonValue
    public String parameterName() {
        return parameterName;
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Looks up a method by its query parameter name (case-sensitive, as sent by clients).
     */
    public static Optional<AggregateMethod> fromParameter(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(m -> m.parameterName.equals(value)).findFirst();
    }

    /**
     * Method used for one sub-field of a composite path.
     *
     * <p>Only numeric sub-fields honour the requested method. Non-numeric sub-fields
     * always report their first value in the bucket, and {@code middle_index} degrades
     * to {@code first} because composite queries do not use window functions.
     */
    public AggregateMethod forComponent(ComponentDataType dataType) {
        if (dataType != ComponentDataType.NUMERIC || this == MIDDLE_INDEX) {
            return FIRST;
        }
        return this;
    }
}
