package org.openphc.patientvault.security;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves the client address recorded in audit entries. Forwarding headers are only
 * honoured when the direct peer is a configured trusted proxy.
 */
@Component
@Slf4j
public class ClientIpResolver {

    private static final String UNKNOWN = "unknown";

    private final Set<String> trustedProxies;

    public ClientIpResolver(@Value("${patientvault.security.trusted-proxies:}") String trustedProxyList) {
        this.trustedProxies = trustedProxyList == null || trustedProxyList.isBlank()
                ? Set.of()
                : Arrays.stream(trustedProxyList.split(","))
                        .map(String::trim)
                        .filter(value -> !value.isBlank())
                        .collect(Collectors.toUnmodifiableSet());
        if (!trustedProxies.isEmpty()) {
            log.info("Trusted proxies configured: {}", trustedProxies);
        }
    }

    public String resolveClientIp(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (remoteAddr != null && trustedProxies.contains(remoteAddr)) {
            String forwardedFor = request.getHeader("X-Forwarded-For");
            if (forwardedFor != null && !forwardedFor.isBlank()) {
                String candidate = forwardedFor.split(",")[0].trim();
                if (!candidate.isBlank()) {
                    return candidate;
                }
            }
            String realIp = request.getHeader("X-Real-IP");
            if (realIp != null && !realIp.isBlank()) {
                return realIp.trim();
            }
        } else if (request.getHeader("X-Forwarded-For") != null) {
            log.debug("Ignoring X-Forwarded-For from untrusted peer {}", remoteAddr);
        }
        return remoteAddr != null ? remoteAddr : UNKNOWN;
    }
}
