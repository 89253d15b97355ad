/* (C)2026 */
package com.ammann.history.exception;

/**
 * Raised when a history request is aborted before all per-path queries finished,
 * either because the client went away or because the worker thread was interrupted.
 *
 * <p>Mapped to HTTP 503 (Service Unavailable) by {@link GlobalExceptionHandler}.
 */
public class QueryCancelledException extends ApiException {

    public QueryCancelledException(String message) {
        super(message);
    }
}
