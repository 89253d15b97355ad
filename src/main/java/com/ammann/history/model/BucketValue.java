/* (C)2026 */
package com.ammann.history.model;

/**
 * Aggregated value of one path for one bucket.
 *
 * @param timestamp bucket start, fixed-width UTC rendering
 * @param value number, decoded structured value, or sub-field map; never {@code null}
 */
public record BucketValue(String timestamp, Object value) {}
