package org.openphc.patientvault.api.exception;

import lombok.Getter;
import org.openphc.patientvault.domain.model.enums.AuditAction;

/**
 * Exception thrown when an audit entry cannot be written to the store.
 */
@Getter
public class AuditPersistenceException extends RuntimeException {

    private final AuditAction action;

    public AuditPersistenceException(AuditAction action, Throwable cause) {
        super("Failed to write " + action + " audit entry", cause);
        this.action = action;
    }
}
