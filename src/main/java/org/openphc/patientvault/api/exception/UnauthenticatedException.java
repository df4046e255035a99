package org.openphc.patientvault.api.exception;

/**
 * Exception thrown when the request carries no usable principal.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
