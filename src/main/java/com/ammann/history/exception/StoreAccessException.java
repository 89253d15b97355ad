/* (C)2026 */
package com.ammann.history.exception;

/**
 * Raised when the columnar store cannot be read (engine unavailable, unreadable
 * data directory, failed discovery scan).
 *
 * <p>Mapped to HTTP 503 (Service Unavailable) by {@link GlobalExceptionHandler}.
 */
public class StoreAccessException extends ApiException {

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreAccessException(String message) {
        super(message);
    }
}
