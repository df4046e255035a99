package org.openphc.patientvault.api.exception;

import lombok.Getter;

/**
 * Exception thrown when a patient field fails validation.
 */
@Getter
public class PatientValidationException extends RuntimeException {

    private final String field;

    public PatientValidationException(String message, String field) {
        super(message);
        this.field = field;
    }
}
