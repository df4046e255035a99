package org.openphc.patientvault.api.exception;

/**
 * Exception thrown when an uploaded spreadsheet cannot be read as a whole.
 * Aborts the batch, unlike row-level validation failures.
 */
public class SpreadsheetParseException extends RuntimeException {

    public SpreadsheetParseException(String message) {
        super(message);
    }

    public SpreadsheetParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
