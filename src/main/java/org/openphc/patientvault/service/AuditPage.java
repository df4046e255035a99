package org.openphc.patientvault.service;

import lombok.Builder;
import lombok.Value;
import org.openphc.patientvault.domain.model.AuditLogEntry;

import java.util.List;

/**
 * One page of the audit trail, bounded by the snapshot id taken on the first page.
 */
@Value
@Builder
public class AuditPage {

    List<AuditLogEntry> entries;
    long total;
    int page;
    int limit;
    long snapshotId;
}
