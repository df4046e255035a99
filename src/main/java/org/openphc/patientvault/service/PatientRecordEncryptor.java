package org.openphc.patientvault.service;

import lombok.RequiredArgsConstructor;
import org.openphc.patientvault.crypto.EncryptedValue;
import org.openphc.patientvault.crypto.EncryptionKey;
import org.openphc.patientvault.crypto.FieldCipher;
import org.openphc.patientvault.domain.model.PatientRecord;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Turns validated plaintext into an encrypted {@link PatientRecord} for insert.
 */
@Component
@RequiredArgsConstructor
public class PatientRecordEncryptor {

    private final FieldCipher fieldCipher;
    private final EncryptionKey encryptionKey;

    public PatientRecord encryptNew(ValidatedPatient patient, UUID ownerManagerId) {
        return PatientRecord.builder()
                .patientId(patient.getPatientId())
                .firstName(encryptField(patient.getFirstName()))
                .lastName(encryptField(patient.getLastName()))
                .dateOfBirth(encryptField(patient.getDateOfBirth().toString()))
                .gender(encryptField(patient.getGender().getDisplayName()))
                .ownerManagerId(ownerManagerId)
                .build();
    }

    public EncryptedValue encryptField(String plaintext) {
        return fieldCipher.encryptText(plaintext, encryptionKey);
    }
}
