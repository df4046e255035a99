package org.openphc.patientvault.security;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.openphc.patientvault.api.exception.UnauthenticatedException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Reads the principal from headers set by the authentication gateway after it has
 * verified the session token.
 */
@Component
@Slf4j
public class HeaderPrincipalResolver implements PrincipalResolver {

    public static final String PRINCIPAL_ID_HEADER = "X-Principal-Id";
    public static final String PRINCIPAL_ROLE_HEADER = "X-Principal-Role";

    @Override
    public AuthenticatedPrincipal resolve(HttpServletRequest request) {
        String rawId = request.getHeader(PRINCIPAL_ID_HEADER);
        String rawRole = request.getHeader(PRINCIPAL_ROLE_HEADER);
        if (rawId == null || rawId.isBlank() || rawRole == null || rawRole.isBlank()) {
            throw new UnauthenticatedException("Missing authenticated principal");
        }
        try {
            UUID id = UUID.fromString(rawId.trim());
            PrincipalRole role = PrincipalRole.valueOf(rawRole.trim().toUpperCase(Locale.ROOT));
            return new AuthenticatedPrincipal(id, role);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected malformed principal headers");
            throw new UnauthenticatedException("Malformed authenticated principal");
        }
    }
}
