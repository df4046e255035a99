package org.openphc.patientvault.ingest;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One spreadsheet data row, untrusted and not yet validated.
 * Blank cells are null. {@code dateOfBirthCell} is set when the cell is date-formatted,
 * otherwise {@code dateOfBirth} holds its text.
 */
@Value
@Builder
public class PatientRow {

    /** 1-based row number in the sheet; the header is row 1. */
    int rowNumber;

    String patientId;
    String firstName;
    String lastName;
    String dateOfBirth;
    LocalDate dateOfBirthCell;
    String gender;
}
