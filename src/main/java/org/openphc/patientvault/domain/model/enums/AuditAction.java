package org.openphc.patientvault.domain.model.enums;

/**
 * Kind of operation recorded in the patient audit trail.
 */
public enum AuditAction {
    UPLOAD,
    EDIT,
    ACCESS,
    DELETE
}
