package org.openphc.patientvault.security;

/**
 * Role of the authenticated caller, as asserted by the authentication gateway.
 */
public enum PrincipalRole {
    ADMIN,
    MANAGER,
    USER;

    public boolean canManagePatients() {
        return this == ADMIN || this == MANAGER;
    }
}
