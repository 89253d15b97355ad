/* (C)2026 */
package com.ammann.history.exception;

/**
 * Signals that the unit preference provider could not supply conversion metadata.
 *
 * <p>Never surfaces to clients: the unit conversion stage catches it and returns
 * values unconverted.
 */
public class ConversionProviderException extends ApiException {

    public ConversionProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConversionProviderException(String message) {
        super(message);
    }
}
