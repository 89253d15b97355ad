package com.ammann.history.exception;

/**
 * Base unchecked exception for all application-level errors in the history API.
 *
 * <p>Subclasses represent specific error categories (validation, store access,
 * cancelled or timed-out queries) and are mapped to HTTP status
 * codes by {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}
