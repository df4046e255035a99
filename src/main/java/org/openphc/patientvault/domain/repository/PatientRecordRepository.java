package org.openphc.patientvault.domain.repository;

import org.openphc.patientvault.domain.model.PatientRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Raw table access for patient records. Only {@link JpaManagerScopedPatientRepository}
 * may use it; everything else goes through {@link ManagerScopedPatientRepository}.
 */
@Repository
public interface PatientRecordRepository extends JpaRepository<PatientRecord, UUID> {

    boolean existsByPatientId(String patientId);

    Page<PatientRecord> findByOwnerManagerId(UUID ownerManagerId, Pageable pageable);

    Page<PatientRecord> findByOwnerManagerIdAndPatientIdContainingIgnoreCase(
            UUID ownerManagerId, String patientId, Pageable pageable);
}
