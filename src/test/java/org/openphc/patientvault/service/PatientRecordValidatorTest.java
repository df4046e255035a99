package org.openphc.patientvault.service;

import org.junit.jupiter.api.Test;
import org.openphc.patientvault.api.dto.PatientCreateRequest;
import org.openphc.patientvault.api.exception.PatientValidationException;
import org.openphc.patientvault.domain.model.enums.Gender;
import org.openphc.patientvault.ingest.PatientRow;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PatientRecordValidator.
 */
class PatientRecordValidatorTest {

    private final PatientRecordValidator validator = new PatientRecordValidator(
            Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC));

    private PatientRow.PatientRowBuilder validRow() {
        return PatientRow.builder()
                .rowNumber(2)
                .patientId("PT-001")
                .firstName("Jane")
                .lastName("Doe")
                .dateOfBirth("1990-01-01")
                .gender("Female");
    }

    @Test
    void shouldAcceptValidRow() {
        RowValidationResult result = validator.validate(validRow().build());

        assertTrue(result.isValid());
        assertEquals(2, result.getRowNumber());
        assertEquals("PT-001", result.getPatient().getPatientId());
        assertEquals(LocalDate.of(1990, 1, 1), result.getPatient().getDateOfBirth());
        assertEquals(Gender.FEMALE, result.getPatient().getGender());
    }

    @Test
    void shouldTrimValues() {
        RowValidationResult result = validator.validate(validRow()
                .patientId("  PT-002 ")
                .firstName(" John ")
                .build());

        assertEquals("PT-002", result.getPatient().getPatientId());
        assertEquals("John", result.getPatient().getFirstName());
    }

    @Test
    void shouldPreferDateFormattedCell() {
        RowValidationResult result = validator.validate(validRow()
                .dateOfBirth("1/1/90")
                .dateOfBirthCell(LocalDate.of(1990, 1, 1))
                .build());

        assertTrue(result.isValid());
        assertEquals(LocalDate.of(1990, 1, 1), result.getPatient().getDateOfBirth());
    }

    @Test
    void shouldRejectMissingPatientId() {
        RowValidationResult result = validator.validate(validRow().patientId(null).build());

        assertFalse(result.isValid());
        assertEquals("Patient ID is required", result.getError());
    }

    @Test
    void shouldRejectOverlongPatientId() {
        RowValidationResult result = validator.validate(validRow().patientId("P".repeat(65)).build());

        assertFalse(result.isValid());
        assertEquals("Patient ID exceeds 64 characters", result.getError());
    }

    @Test
    void shouldRejectMissingName() {
        RowValidationResult result = validator.validate(validRow().lastName("  ").build());

        assertEquals("Last Name is required", result.getError());
    }

    @Test
    void shouldRejectImpossibleDateWithoutEchoingIt() {
        RowValidationResult result = validator.validate(validRow().dateOfBirth("1990-02-30").build());

        assertFalse(result.isValid());
        assertEquals("Date of Birth must be a valid date (YYYY-MM-DD)", result.getError());
        assertFalse(result.getError().contains("1990-02-30"));
    }

    @Test
    void shouldRejectFutureDate() {
        RowValidationResult result = validator.validate(validRow().dateOfBirth("2024-06-16").build());

        assertEquals("Date of Birth cannot be in the future", result.getError());
    }

    @Test
    void shouldAcceptToday() {
        assertTrue(validator.validate(validRow().dateOfBirth("2024-06-15").build()).isValid());
    }

    @Test
    void shouldAcceptGenderCodesCaseInsensitively() {
        assertEquals(Gender.MALE, validator.validateGender("m"));
        assertEquals(Gender.OTHER, validator.validateGender("OTHER"));
        assertEquals(Gender.UNKNOWN, validator.validateGender(" unknown "));
    }

    @Test
    void shouldRejectGenderOutsideClosedSet() {
        RowValidationResult result = validator.validate(validRow().gender("X").build());

        assertEquals("Gender must be one of: Male, Female, Other, Unknown", result.getError());
    }

    @Test
    void shouldReportFirstFailingField() {
        RowValidationResult result = validator.validate(validRow()
                .patientId("")
                .gender("X")
                .build());

        assertEquals("Patient ID is required", result.getError());
    }

    @Test
    void shouldThrowForInvalidCreateRequest() {
        PatientCreateRequest request = PatientCreateRequest.builder()
                .patientId("PT-009")
                .firstName("Ana")
                .lastName("Lopez")
                .dateOfBirth("31-12-1980")
                .gender("F")
                .build();

        PatientValidationException ex = assertThrows(PatientValidationException.class,
                () -> validator.validate(request));
        assertEquals("date_of_birth", ex.getField());
    }
}
