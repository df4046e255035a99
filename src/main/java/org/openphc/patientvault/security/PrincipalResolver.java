package org.openphc.patientvault.security;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the authenticated caller of a request. Authentication itself happens upstream.
 */
public interface PrincipalResolver {

    /**
     * @throws org.openphc.patientvault.api.exception.UnauthenticatedException if no principal is present
     */
    AuthenticatedPrincipal resolve(HttpServletRequest request);
}
