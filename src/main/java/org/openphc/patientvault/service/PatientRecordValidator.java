package org.openphc.patientvault.service;

import lombok.extern.slf4j.Slf4j;
import org.openphc.patientvault.api.dto.PatientCreateRequest;
import org.openphc.patientvault.api.exception.PatientValidationException;
import org.openphc.patientvault.domain.model.enums.Gender;
import org.openphc.patientvault.domain.model.enums.ProtectedField;
import org.openphc.patientvault.ingest.PatientRow;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Validates patient values from uploads, single registrations and edits.
 * Messages name the field but never echo the rejected value.
 */
@Component
@Slf4j
public class PatientRecordValidator {

    public static final int MAX_PATIENT_ID_LENGTH = 64;
    public static final int MAX_NAME_LENGTH = 100;

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private final Clock clock;

    public PatientRecordValidator() {
        this(Clock.systemUTC());
    }

    PatientRecordValidator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Validate a spreadsheet row. Never throws; failures come back as an invalid result.
     */
    public RowValidationResult validate(PatientRow row) {
        try {
            ValidatedPatient patient = ValidatedPatient.builder()
                    .patientId(validatePatientId(row.getPatientId()))
                    .firstName(validateName(row.getFirstName(), ProtectedField.FIRST_NAME))
                    .lastName(validateName(row.getLastName(), ProtectedField.LAST_NAME))
                    .dateOfBirth(row.getDateOfBirthCell() != null
                            ? validateDateOfBirth(row.getDateOfBirthCell())
                            : validateDateOfBirth(row.getDateOfBirth()))
                    .gender(validateGender(row.getGender()))
                    .build();
            return RowValidationResult.valid(row.getRowNumber(), patient);
        } catch (PatientValidationException e) {
            log.debug("Row {} rejected: {}", row.getRowNumber(), e.getMessage());
            return RowValidationResult.invalid(row.getRowNumber(), e.getMessage());
        }
    }

    /**
     * Validate a single registration. Throws on the first invalid field.
     */
    public ValidatedPatient validate(PatientCreateRequest request) {
        return ValidatedPatient.builder()
                .patientId(validatePatientId(request.getPatientId()))
                .firstName(validateName(request.getFirstName(), ProtectedField.FIRST_NAME))
                .lastName(validateName(request.getLastName(), ProtectedField.LAST_NAME))
                .dateOfBirth(validateDateOfBirth(request.getDateOfBirth()))
                .gender(validateGender(request.getGender()))
                .build();
    }

    public String validatePatientId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new PatientValidationException("Patient ID is required", "patient_id");
        }
        String value = raw.trim();
        if (value.length() > MAX_PATIENT_ID_LENGTH) {
            throw new PatientValidationException(
                    "Patient ID exceeds " + MAX_PATIENT_ID_LENGTH + " characters", "patient_id");
        }
        return value;
    }

    public String validateName(String raw, ProtectedField field) {
        if (raw == null || raw.isBlank()) {
            throw new PatientValidationException(field.getLabel() + " is required", field.getColumnName());
        }
        String value = raw.trim();
        if (value.length() > MAX_NAME_LENGTH) {
            throw new PatientValidationException(
                    field.getLabel() + " exceeds " + MAX_NAME_LENGTH + " characters", field.getColumnName());
        }
        return value;
    }

    public LocalDate validateDateOfBirth(String raw) {
        String field = ProtectedField.DATE_OF_BIRTH.getColumnName();
        if (raw == null || raw.isBlank()) {
            throw new PatientValidationException("Date of Birth is required", field);
        }
        LocalDate date;
        try {
            date = LocalDate.parse(raw.trim(), ISO_DATE);
        } catch (DateTimeParseException e) {
            throw new PatientValidationException("Date of Birth must be a valid date (YYYY-MM-DD)", field);
        }
        return validateDateOfBirth(date);
    }

    public LocalDate validateDateOfBirth(LocalDate date) {
        if (date.isAfter(LocalDate.now(clock))) {
            throw new PatientValidationException(
                    "Date of Birth cannot be in the future", ProtectedField.DATE_OF_BIRTH.getColumnName());
        }
        return date;
    }

    public Gender validateGender(String raw) {
        String field = ProtectedField.GENDER.getColumnName();
        if (raw == null || raw.isBlank()) {
            throw new PatientValidationException("Gender is required", field);
        }
        return Gender.fromInput(raw).orElseThrow(() -> new PatientValidationException(
                "Gender must be one of: " + Gender.allowedValues(), field));
    }
}
