package org.openphc.patientvault.service;

import lombok.Builder;
import lombok.Value;
import org.openphc.patientvault.domain.model.enums.Gender;

import java.time.LocalDate;

/**
 * Plaintext patient values that passed validation, ready to be encrypted.
 */
@Value
@Builder
public class ValidatedPatient {

    String patientId;
    String firstName;
    String lastName;
    LocalDate dateOfBirth;
    Gender gender;
}
