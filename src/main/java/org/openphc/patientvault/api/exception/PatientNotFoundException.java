package org.openphc.patientvault.api.exception;

import java.util.UUID;

/**
 * Exception thrown when a patient record does not exist.
 */
public class PatientNotFoundException extends RuntimeException {

    public PatientNotFoundException(UUID recordId) {
        super("Patient record not found: " + recordId);
    }
}
