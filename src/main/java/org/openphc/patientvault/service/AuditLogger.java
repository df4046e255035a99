package org.openphc.patientvault.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.openphc.patientvault.api.exception.AuditPersistenceException;
import org.openphc.patientvault.domain.model.AuditLogEntry;
import org.openphc.patientvault.domain.model.enums.AuditAction;
import org.openphc.patientvault.domain.repository.AuditLogEntryRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Append-only recorder for the patient audit trail.
 *
 * <p>Write-path actions (UPLOAD, EDIT, DELETE) use {@link #record}, which fails when the
 * store is unavailable so the triggering operation fails with it. Reads use
 * {@link #recordAccess}, which downgrades a store failure to a warning and a metric.
 */
@Service
@Slf4j
public class AuditLogger {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "occurredAt")
            .and(Sort.by(Sort.Direction.DESC, "id"));

    private final AuditLogEntryRepository auditLogEntryRepository;
    private final Counter degradedAccessCounter;
    private final Clock clock;

    // high-water mark keeping timestamps monotonic within this process
    private final AtomicReference<OffsetDateTime> lastTimestamp =
            new AtomicReference<>(OffsetDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC));

    @Autowired
    public AuditLogger(AuditLogEntryRepository auditLogEntryRepository, MeterRegistry meterRegistry) {
        this(auditLogEntryRepository, meterRegistry, Clock.systemUTC());
    }

    AuditLogger(AuditLogEntryRepository auditLogEntryRepository, MeterRegistry meterRegistry, Clock clock) {
        this.auditLogEntryRepository = auditLogEntryRepository;
        this.clock = clock;
        this.degradedAccessCounter = Counter.builder("patientvault.audit.access.failures")
                .description("ACCESS audit entries that could not be written")
                .register(meterRegistry);
    }

    /**
     * Append an entry.
     *
     * @throws AuditPersistenceException if the audit store is unavailable
     */
    public AuditLogEntry record(AuditAction action, UUID performedBy, UUID patientRecordId,
                                String details, String clientIp) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(performedBy, "performedBy");

        AuditLogEntry entry = AuditLogEntry.builder()
                .action(action)
                .performedBy(performedBy)
                .patientRecordId(patientRecordId)
                .details(truncate(details))
                .clientIp(clientIp)
                .occurredAt(nextTimestamp())
                .build();

        try {
            AuditLogEntry saved = auditLogEntryRepository.save(entry);
            log.debug("Audit entry written: id={}, action={}, performedBy={}", saved.getId(), action, performedBy);
            return saved;
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to write audit entry: action={}, performedBy={}: {}",
                    action, performedBy, e.getMessage());
            throw new AuditPersistenceException(action, e);
        }
    }

    /**
     * Append an ACCESS entry, tolerating an unavailable store.
     *
     * @return the entry, or empty if it could not be written
     */
    public Optional<AuditLogEntry> recordAccess(UUID performedBy, UUID patientRecordId,
                                                String details, String clientIp) {
        try {
            return Optional.of(record(AuditAction.ACCESS, performedBy, patientRecordId, details, clientIp));
        } catch (AuditPersistenceException e) {
            degradedAccessCounter.increment();
            log.warn("ACCESS audit entry for principal {} not written, serving read anyway", performedBy);
            return Optional.empty();
        }
    }

    /**
     * Page through entries newest first.
     *
     * @param performedBy restrict to one principal, or null for all
     * @param page        1-based page number
     * @param snapshotId  upper bound returned by the first page, or null to take a new one
     */
    @Transactional(readOnly = true)
    public AuditPage query(UUID performedBy, int page, int limit, Long snapshotId) {
        if (page < 1 || limit < 1) {
            throw new IllegalArgumentException("page and limit must be positive");
        }
        long snapshot = snapshotId != null ? snapshotId : currentSnapshot();
        PageRequest pageRequest = PageRequest.of(page - 1, limit, NEWEST_FIRST);

        Page<AuditLogEntry> result = performedBy == null
                ? auditLogEntryRepository.findByIdLessThanEqual(snapshot, pageRequest)
                : auditLogEntryRepository.findByPerformedByAndIdLessThanEqual(performedBy, snapshot, pageRequest);

        return AuditPage.builder()
                .entries(result.getContent())
                .total(result.getTotalElements())
                .page(page)
                .limit(limit)
                .snapshotId(snapshot)
                .build();
    }

    private long currentSnapshot() {
        Long maxId = auditLogEntryRepository.findMaxId();
        return maxId != null ? maxId : 0L;
    }

    private static String truncate(String details) {
        if (details == null || details.length() <= AuditLogEntry.MAX_DETAILS_LENGTH) {
            return details;
        }
        return details.substring(0, AuditLogEntry.MAX_DETAILS_LENGTH - 3) + "...";
    }

    private OffsetDateTime nextTimestamp() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        // microsecond step matches PostgreSQL timestamp precision
        return lastTimestamp.accumulateAndGet(now,
                (previous, candidate) -> candidate.isAfter(previous) ? candidate : previous.plusNanos(1_000));
    }
}
