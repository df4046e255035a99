package org.openphc.patientvault.api.exception;

/**
 * Exception thrown when an encrypted field fails authentication on decrypt.
 */
public class IntegrityException extends RuntimeException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
