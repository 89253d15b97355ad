/* (C)2026 */
package com.ammann.history.exception;

import java.time.Duration;

/**
 * Raised when the per-path queries of a request did not finish within the configured
 * request deadline. All in-flight statements have been cancelled when this is thrown.
 *
 * <p>Mapped to HTTP 504 (Gateway Timeout) by {@link GlobalExceptionHandler}.
 */
public class QueryTimeoutException extends ApiException {

    public QueryTimeoutException(Duration timeout, int pendingPaths) {
        super(String.format(
                "History query exceeded %d ms with %d path queries still running",
                timeout.toMillis(), pendingPaths));
    }
}
