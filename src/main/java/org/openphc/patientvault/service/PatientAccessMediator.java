package org.openphc.patientvault.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.openphc.patientvault.api.dto.PatientCreateRequest;
import org.openphc.patientvault.api.dto.PatientDto;
import org.openphc.patientvault.api.dto.PatientUpdateRequest;
import org.openphc.patientvault.api.exception.IntegrityException;
import org.openphc.patientvault.api.exception.PatientValidationException;
import org.openphc.patientvault.crypto.EncryptionKey;
import org.openphc.patientvault.crypto.FieldCipher;
import org.openphc.patientvault.domain.model.PatientRecord;
import org.openphc.patientvault.domain.model.PatientRecordPatch;
import org.openphc.patientvault.domain.model.enums.AuditAction;
import org.openphc.patientvault.domain.model.enums.ProtectedField;
import org.openphc.patientvault.domain.repository.ManagerScopedPatientRepository;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The only place where plaintext patient data and the key meet: decrypts on read,
 * encrypts on write, audits every operation, and scopes everything to the caller's
 * manager id. Plaintext lives only for the duration of one call.
 *
 * <p>Reads run outside a transaction; a failed ACCESS audit write must not affect them.
 * Writes share one transaction with their audit entry.
 */
@Service
@Slf4j
public class PatientAccessMediator {

    private final ManagerScopedPatientRepository patientRepository;
    private final FieldCipher fieldCipher;
    private final EncryptionKey encryptionKey;
    private final PatientRecordEncryptor recordEncryptor;
    private final PatientRecordValidator validator;
    private final AuditLogger auditLogger;
    private final Counter integrityFailures;

    public PatientAccessMediator(
            ManagerScopedPatientRepository patientRepository,
            FieldCipher fieldCipher,
            EncryptionKey encryptionKey,
            PatientRecordEncryptor recordEncryptor,
            PatientRecordValidator validator,
            AuditLogger auditLogger,
            MeterRegistry meterRegistry) {
        this.patientRepository = patientRepository;
        this.fieldCipher = fieldCipher;
        this.encryptionKey = encryptionKey;
        this.recordEncryptor = recordEncryptor;
        this.validator = validator;
        this.auditLogger = auditLogger;
        this.integrityFailures = Counter.builder("patientvault.cipher.integrity.failures")
                .description("Patient records that failed authenticated decryption")
                .register(meterRegistry);
    }

    /**
     * List one page of the manager's patients, decrypted. Records that fail decryption
     * are left out rather than failing the page. One ACCESS entry per call.
     */
    public DecryptedPatientPage listDecrypted(UUID managerId, String search, int page, int limit, String clientIp) {
        String term = search == null || search.isBlank() ? null : search.trim();
        Page<PatientRecord> records = patientRepository.findByOwner(managerId, term, page, limit);

        List<PatientDto> patients = new ArrayList<>(records.getNumberOfElements());
        List<UUID> withheld = new ArrayList<>();
        for (PatientRecord record : records.getContent()) {
            try {
                patients.add(decrypt(record));
            } catch (IntegrityException e) {
                integrityFailures.increment();
                withheld.add(record.getId());
                log.error("Withholding patient record {} from list: {}", record.getId(), e.getMessage());
            }
        }

        auditLogger.recordAccess(managerId, null,
                describeListAccess(page, limit, term, patients.size(), withheld), clientIp);

        return DecryptedPatientPage.builder()
                .patients(patients)
                .total(records.getTotalElements())
                .page(page)
                .limit(limit)
                .withheld(withheld.size())
                .build();
    }

    /**
     * Fetch one of the manager's patients, decrypted. Unlike listing, a record that
     * fails decryption is a hard failure.
     */
    public PatientDto getDecrypted(UUID managerId, UUID recordId, String clientIp) {
        PatientRecord record = patientRepository.findOwned(managerId, recordId);
        try {
            PatientDto patient = decrypt(record);
            auditLogger.recordAccess(managerId, recordId, "Accessed patient record", clientIp);
            return patient;
        } catch (IntegrityException e) {
            integrityFailures.increment();
            log.error("Patient record {} failed decryption: {}", recordId, e.getMessage());
            auditLogger.recordAccess(managerId, recordId, "Access failed: integrity check failed", clientIp);
            throw e;
        }
    }

    /**
     * Register a single patient owned by the manager.
     */
    @Transactional
    public PatientDto create(UUID managerId, PatientCreateRequest request, String clientIp) {
        ValidatedPatient patient = validator.validate(request);
        PatientRecord saved = patientRepository.insert(recordEncryptor.encryptNew(patient, managerId));

        auditLogger.record(AuditAction.UPLOAD, managerId, saved.getId(),
                "Created patient record " + saved.getPatientId(), clientIp);
        log.info("Created patient record id={} for manager={}", saved.getId(), managerId);

        return PatientDto.builder()
                .id(saved.getId())
                .patientId(saved.getPatientId())
                .firstName(patient.getFirstName())
                .lastName(patient.getLastName())
                .dateOfBirth(patient.getDateOfBirth().toString())
                .gender(patient.getGender().getDisplayName())
                .createdAt(saved.getCreatedAt())
                .updatedAt(saved.getUpdatedAt())
                .build();
    }

    /**
     * Apply a partial edit. Ownership is checked before the request is validated, so a
     * foreign or unknown id never reveals anything through validation errors. Only fields
     * present in the request are re-encrypted; the EDIT entry lists field names, never values.
     */
    @Transactional
    public PatientDto edit(UUID managerId, UUID recordId, PatientUpdateRequest request, String clientIp) {
        patientRepository.findOwned(managerId, recordId);

        PatientRecordPatch.PatientRecordPatchBuilder patch = PatientRecordPatch.builder();
        List<String> changed = new ArrayList<>();

        if (request.getPatientId() != null) {
            patch.patientId(validator.validatePatientId(request.getPatientId()));
            changed.add("patient_id");
        }
        if (request.getFirstName() != null) {
            String value = validator.validateName(request.getFirstName(), ProtectedField.FIRST_NAME);
            patch.encryptedField(ProtectedField.FIRST_NAME, recordEncryptor.encryptField(value));
            changed.add(ProtectedField.FIRST_NAME.getColumnName());
        }
        if (request.getLastName() != null) {
            String value = validator.validateName(request.getLastName(), ProtectedField.LAST_NAME);
            patch.encryptedField(ProtectedField.LAST_NAME, recordEncryptor.encryptField(value));
            changed.add(ProtectedField.LAST_NAME.getColumnName());
        }
        if (request.getDateOfBirth() != null) {
            String value = validator.validateDateOfBirth(request.getDateOfBirth()).toString();
            patch.encryptedField(ProtectedField.DATE_OF_BIRTH, recordEncryptor.encryptField(value));
            changed.add(ProtectedField.DATE_OF_BIRTH.getColumnName());
        }
        if (request.getGender() != null) {
            String value = validator.validateGender(request.getGender()).getDisplayName();
            patch.encryptedField(ProtectedField.GENDER, recordEncryptor.encryptField(value));
            changed.add(ProtectedField.GENDER.getColumnName());
        }
        PatientRecordPatch built = patch.build();
        if (built.isEmpty()) {
            throw new PatientValidationException("No fields to update", null);
        }

        PatientRecord updated = patientRepository.update(recordId, managerId, built);
        auditLogger.record(AuditAction.EDIT, managerId, recordId,
                "Updated fields: " + String.join(", ", changed), clientIp);
        log.info("Edited patient record id={} fields={}", recordId, changed);

        return decrypt(updated);
    }

    /**
     * Delete one of the manager's patients. The audit trail keeps the record id.
     */
    @Transactional
    public void delete(UUID managerId, UUID recordId, String clientIp) {
        PatientRecord removed = patientRepository.delete(recordId, managerId);
        auditLogger.record(AuditAction.DELETE, managerId, recordId,
                "Deleted patient record " + removed.getPatientId(), clientIp);
        log.info("Deleted patient record id={} for manager={}", recordId, managerId);
    }

    private PatientDto decrypt(PatientRecord record) {
        return PatientDto.builder()
                .id(record.getId())
                .patientId(record.getPatientId())
                .firstName(decryptField(record, ProtectedField.FIRST_NAME))
                .lastName(decryptField(record, ProtectedField.LAST_NAME))
                .dateOfBirth(decryptField(record, ProtectedField.DATE_OF_BIRTH))
                .gender(decryptField(record, ProtectedField.GENDER))
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }

    private String decryptField(PatientRecord record, ProtectedField field) {
        return fieldCipher.decryptText(record.getProtectedField(field), encryptionKey);
    }

    private String describeListAccess(int page, int limit, String search, int returned, List<UUID> withheld) {
        StringBuilder details = new StringBuilder()
                .append("Accessed patient list (page=").append(page)
                .append(", limit=").append(limit)
                .append(", search='").append(search != null ? search : "").append("'")
                .append(", returned=").append(returned)
                .append(", withheld=").append(withheld.size()).append(')');
        if (!withheld.isEmpty()) {
            details.append("; integrity failures: ")
                    .append(withheld.stream().map(UUID::toString).collect(Collectors.joining(", ")));
        }
        return details.toString();
    }
}
