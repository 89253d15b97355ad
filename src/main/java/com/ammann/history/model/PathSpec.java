/* (C)2026 */
package com.ammann.history.model;

import com.ammann.history.enumeration.AggregateMethod;

/**
 * One requested signal path together with its bucket aggregation.
 *
 * @param path dot-separated signal path, e.g. {@code navigation.speedOverGround}
 * @param aggregateMethod aggregation applied per bucket
 * @param queryResultName column-safe alias derived from the path
 */
public record PathSpec(String path, AggregateMethod aggregateMethod, String queryResultName) {

    public static PathSpec of(String path, AggregateMethod aggregateMethod) {
        return new PathSpec(path, aggregateMethod, path.replace('.', '_'));
    }

    public String aggregateFunction() {
        return aggregateMethod.functionName();
    }
}
