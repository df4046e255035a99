package org.openphc.patientvault.api.exception;

import lombok.Getter;

/**
 * Exception thrown when a patient ID is already registered (by any manager).
 */
@Getter
public class DuplicatePatientException extends RuntimeException {

    private final String patientId;

    public DuplicatePatientException(String patientId) {
        super("Patient ID already exists: " + patientId);
        this.patientId = patientId;
    }

    public DuplicatePatientException(String patientId, Throwable cause) {
        super("Patient ID already exists: " + patientId, cause);
        this.patientId = patientId;
    }
}
