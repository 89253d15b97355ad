/* (C)2026 */
package com.ammann.history.enumeration;

/**
 * Shape of a path's values, decided once per request by the schema probe.
 */
public enum SeriesShape {
    /** One numeric (or encoded structured) value per bucket. */
    SCALAR,
    /** An object of named sub-fields per bucket, e.g. a position. */
    COMPOSITE
}
