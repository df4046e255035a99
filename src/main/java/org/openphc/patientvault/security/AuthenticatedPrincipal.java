package org.openphc.patientvault.security;

import lombok.Value;
import org.openphc.patientvault.api.exception.PatientAccessDeniedException;

import java.util.UUID;

/**
 * Caller identity and role. For managers the id is also the record ownership scope.
 */
@Value
public class AuthenticatedPrincipal {

    UUID id;
    PrincipalRole role;

    public void requirePatientAccess() {
        if (!role.canManagePatients()) {
            throw new PatientAccessDeniedException("Only managers can access patient data");
        }
    }

    public boolean isAdmin() {
        return role == PrincipalRole.ADMIN;
    }
}
