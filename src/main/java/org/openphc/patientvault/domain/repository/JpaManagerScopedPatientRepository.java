package org.openphc.patientvault.domain.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.patientvault.api.exception.DuplicatePatientException;
import org.openphc.patientvault.api.exception.PatientAccessDeniedException;
import org.openphc.patientvault.api.exception.PatientNotFoundException;
import org.openphc.patientvault.domain.model.PatientRecord;
import org.openphc.patientvault.domain.model.PatientRecordPatch;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA implementation of the manager-scoped patient store.
 * The owner filter is part of every query, not an optional argument.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JpaManagerScopedPatientRepository implements ManagerScopedPatientRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt")
            .and(Sort.by(Sort.Direction.DESC, "id"));

    private final PatientRecordRepository patientRecordRepository;

    @Override
    @Transactional
    public PatientRecord insert(PatientRecord record) {
        Objects.requireNonNull(record.getOwnerManagerId(), "patient record must have an owning manager");
        Objects.requireNonNull(record.getPatientId(), "patient record must have a patient ID");

        if (patientRecordRepository.existsByPatientId(record.getPatientId())) {
            throw new DuplicatePatientException(record.getPatientId());
        }
        try {
            PatientRecord saved = patientRecordRepository.saveAndFlush(record);
            log.debug("Inserted patient record id={} for manager={}", saved.getId(), saved.getOwnerManagerId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // concurrent insert of the same patient ID won the unique constraint
            throw new DuplicatePatientException(record.getPatientId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Page<PatientRecord> findByOwner(UUID managerId, String search, int page, int limit) {
        Objects.requireNonNull(managerId, "managerId");
        if (page < 1 || limit < 1) {
            throw new IllegalArgumentException("page and limit must be positive");
        }
        PageRequest pageRequest = PageRequest.of(page - 1, limit, NEWEST_FIRST);

        if (search == null || search.isBlank()) {
            return patientRecordRepository.findByOwnerManagerId(managerId, pageRequest);
        }
        return patientRecordRepository.findByOwnerManagerIdAndPatientIdContainingIgnoreCase(
                managerId, search.trim(), pageRequest);
    }

    @Override
    @Transactional(readOnly = true)
    public PatientRecord findOwned(UUID managerId, UUID recordId) {
        return loadOwned(recordId, managerId);
    }

    @Override
    @Transactional
    public PatientRecord update(UUID recordId, UUID ownerManagerId, PatientRecordPatch patch) {
        PatientRecord record = loadOwned(recordId, ownerManagerId);

        String newPatientId = patch.getPatientId();
        if (newPatientId != null && !newPatientId.equals(record.getPatientId())) {
            if (patientRecordRepository.existsByPatientId(newPatientId)) {
                throw new DuplicatePatientException(newPatientId);
            }
            record.setPatientId(newPatientId);
        }
        patch.getEncryptedFields().forEach(record::setProtectedField);
        record.setUpdatedAt(OffsetDateTime.now(ZoneOffset.UTC));

        try {
            return patientRecordRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicatePatientException(record.getPatientId(), e);
        }
    }

    @Override
    @Transactional
    public PatientRecord delete(UUID recordId, UUID ownerManagerId) {
        PatientRecord record = loadOwned(recordId, ownerManagerId);
        patientRecordRepository.delete(record);
        patientRecordRepository.flush();
        log.debug("Deleted patient record id={} for manager={}", recordId, ownerManagerId);
        return record;
    }

    private PatientRecord loadOwned(UUID recordId, UUID managerId) {
        Objects.requireNonNull(managerId, "managerId");
        PatientRecord record = patientRecordRepository.findById(recordId)
                .orElseThrow(() -> new PatientNotFoundException(recordId));
        if (!managerId.equals(record.getOwnerManagerId())) {
            log.warn("Cross-manager access rejected: record={}, requester={}", recordId, managerId);
            throw new PatientAccessDeniedException("Patient record " + recordId + " belongs to another manager");
        }
        return record;
    }
}
