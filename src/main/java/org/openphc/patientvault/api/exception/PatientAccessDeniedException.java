package org.openphc.patientvault.api.exception;

/**
 * Exception thrown when a principal acts on data outside its scope or role.
 */
public class PatientAccessDeniedException extends RuntimeException {

    public PatientAccessDeniedException(String message) {
        super(message);
    }
}
