package org.openphc.patientvault.domain.repository;

import org.openphc.patientvault.domain.model.AuditLogEntry;
import org.openphc.patientvault.domain.model.enums.AuditAction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;

import java.util.UUID;

/**
 * Append-only audit store: exposes save and reads, no update or delete.
 */
public interface AuditLogEntryRepository extends Repository<AuditLogEntry, Long> {

    AuditLogEntry save(AuditLogEntry entry);

    Page<AuditLogEntry> findByIdLessThanEqual(Long maxId, Pageable pageable);

    Page<AuditLogEntry> findByPerformedByAndIdLessThanEqual(UUID performedBy, Long maxId, Pageable pageable);

    @Query("select max(e.id) from AuditLogEntry e")
    Long findMaxId();

    long countByAction(AuditAction action);
}
