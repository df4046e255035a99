package org.openphc.patientvault.domain.repository;

import org.openphc.patientvault.domain.model.PatientRecord;
import org.openphc.patientvault.domain.model.PatientRecordPatch;
import org.springframework.data.domain.Page;

import java.util.UUID;

/**
 * Persistence boundary for encrypted patient records. Every read and write is scoped to
 * the owning manager; there is no operation returning another manager's records.
 * Protected fields cross this boundary already encrypted.
 */
public interface ManagerScopedPatientRepository {

    /**
     * Persist a new record.
     *
     * @throws org.openphc.patientvault.api.exception.DuplicatePatientException
     *         if the patient ID is registered under any manager
     */
    PatientRecord insert(PatientRecord record);

    /**
     * Page through one manager's records, newest first.
     *
     * @param search optional case-insensitive substring of the plaintext patient ID
     * @param page   1-based page number
     */
    Page<PatientRecord> findByOwner(UUID managerId, String search, int page, int limit);

    /**
     * Load a single record owned by the manager.
     *
     * @throws org.openphc.patientvault.api.exception.PatientNotFoundException     if absent
     * @throws org.openphc.patientvault.api.exception.PatientAccessDeniedException if owned by another manager
     */
    PatientRecord findOwned(UUID managerId, UUID recordId);

    /**
     * Apply a patch to a record owned by the manager. Same failure modes as
     * {@link #findOwned}, plus a duplicate patient ID when the patch renames it.
     */
    PatientRecord update(UUID recordId, UUID ownerManagerId, PatientRecordPatch patch);

    /**
     * Remove a record owned by the manager and return what was removed.
     */
    PatientRecord delete(UUID recordId, UUID ownerManagerId);
}
