package org.openphc.patientvault.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;
import org.openphc.patientvault.domain.model.enums.AuditAction;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only compliance record of a patient data operation.
 * Details carry metadata only (counts, field names, ids), never decrypted values.
 */
@Entity
@Immutable
@Table(name = "patient_audit_log",
        indexes = {
                @Index(name = "idx_audit_performed_by", columnList = "performed_by"),
                @Index(name = "idx_audit_occurred_at", columnList = "occurred_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class AuditLogEntry {

    public static final int MAX_DETAILS_LENGTH = 8000;

    // identity sequence doubles as the monotonic snapshot key for pagination
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private AuditAction action;

    @Column(name = "performed_by", nullable = false, updatable = false)
    private UUID performedBy;

    @Column(name = "patient_record_id", updatable = false)
    private UUID patientRecordId;

    @Column(updatable = false, length = MAX_DETAILS_LENGTH)
    private String details;

    @Column(name = "client_ip", updatable = false, length = 45)
    private String clientIp;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private OffsetDateTime occurredAt;
}
