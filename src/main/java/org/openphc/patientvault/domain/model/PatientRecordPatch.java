package org.openphc.patientvault.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.openphc.patientvault.crypto.EncryptedValue;
import org.openphc.patientvault.domain.model.enums.ProtectedField;

import java.util.Map;

/**
 * Partial update of a patient record: already-encrypted replacement fields plus an
 * optional new patient ID. Absent entries are left untouched.
 */
@Value
@Builder
public class PatientRecordPatch {

    String patientId;

    @Singular
    Map<ProtectedField, EncryptedValue> encryptedFields;

    public boolean isEmpty() {
        return patientId == null && encryptedFields.isEmpty();
    }
}
