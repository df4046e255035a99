package org.openphc.patientvault.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of validating one spreadsheet row: either a patient or an error message.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RowValidationResult {

    private final int rowNumber;
    private final ValidatedPatient patient;
    private final String error;

    public static RowValidationResult valid(int rowNumber, ValidatedPatient patient) {
        return new RowValidationResult(rowNumber, patient, null);
    }

    public static RowValidationResult invalid(int rowNumber, String error) {
        return new RowValidationResult(rowNumber, null, error);
    }

    public boolean isValid() {
        return patient != null;
    }
}
