package org.openphc.patientvault.api.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.patientvault.api.dto.ApiResponse;
import org.openphc.patientvault.api.dto.AuditLogDto;
import org.openphc.patientvault.api.exception.PatientAccessDeniedException;
import org.openphc.patientvault.api.exception.PatientValidationException;
import org.openphc.patientvault.domain.model.AuditLogEntry;
import org.openphc.patientvault.security.AuthenticatedPrincipal;
import org.openphc.patientvault.security.PrincipalResolver;
import org.openphc.patientvault.service.AuditLogger;
import org.openphc.patientvault.service.AuditPage;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-only view of the patient audit trail. Managers see their own entries,
 * admins see everyone's (optionally filtered by principal).
 */
@RestController
@RequestMapping("/v1/audit")
@RequiredArgsConstructor
@Slf4j
public class AuditTrailController {

    static final int MAX_PAGE_SIZE = 100;

    private final AuditLogger auditLogger;
    private final PrincipalResolver principalResolver;

    @GetMapping
    public ResponseEntity<ApiResponse<List<AuditLogDto>>> listEntries(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) Long snapshot,
            @RequestParam(name = "performed_by", required = false) UUID performedBy,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId,
            HttpServletRequest request) {

        MDC.put("correlationId", correlationId != null ? correlationId : UUID.randomUUID().toString());
        try {
            AuthenticatedPrincipal principal = principalResolver.resolve(request);
            MDC.put("principalId", principal.getId().toString());
            principal.requirePatientAccess();

            if (page < 1 || limit < 1 || limit > MAX_PAGE_SIZE) {
                throw new PatientValidationException(
                        "page must be at least 1 and limit between 1 and " + MAX_PAGE_SIZE, "page");
            }
            UUID scope = resolveScope(principal, performedBy);

            AuditPage result = auditLogger.query(scope, page, limit, snapshot);
            List<AuditLogDto> entries = result.getEntries().stream()
                    .map(this::toDto)
                    .collect(Collectors.toList());

            ApiResponse<List<AuditLogDto>> body = ApiResponse.page(
                    entries, result.getTotal(), result.getPage(), result.getLimit());
            body.setSnapshot(result.getSnapshotId());
            return ResponseEntity.ok(body);
        } finally {
            MDC.clear();
        }
    }

    private UUID resolveScope(AuthenticatedPrincipal principal, UUID requested) {
        if (principal.isAdmin()) {
            return requested;
        }
        if (requested != null && !requested.equals(principal.getId())) {
            log.warn("Manager requested another principal's audit trail");
            throw new PatientAccessDeniedException("Managers can only view their own audit trail");
        }
        return principal.getId();
    }

    private AuditLogDto toDto(AuditLogEntry entry) {
        return AuditLogDto.builder()
                .id(entry.getId())
                .action(entry.getAction().name())
                .performedBy(entry.getPerformedBy())
                .patientRecordId(entry.getPatientRecordId())
                .details(entry.getDetails())
                .clientIp(entry.getClientIp())
                .timestamp(entry.getOccurredAt())
                .build();
    }
}
