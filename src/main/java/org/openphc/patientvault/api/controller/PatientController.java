package org.openphc.patientvault.api.controller;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.patientvault.api.dto.ApiResponse;
import org.openphc.patientvault.api.dto.PatientCreateRequest;
import org.openphc.patientvault.api.dto.PatientDto;
import org.openphc.patientvault.api.dto.PatientUpdateRequest;
import org.openphc.patientvault.api.dto.UploadResponse;
import org.openphc.patientvault.api.exception.PatientValidationException;
import org.openphc.patientvault.security.AuthenticatedPrincipal;
import org.openphc.patientvault.security.ClientIpResolver;
import org.openphc.patientvault.security.PrincipalResolver;
import org.openphc.patientvault.service.DecryptedPatientPage;
import org.openphc.patientvault.service.IngestionResult;
import org.openphc.patientvault.service.PatientAccessMediator;
import org.openphc.patientvault.service.PatientIngestionService;
import org.openphc.patientvault.service.RowError;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Patient endpoints. Every operation is scoped to the calling manager.
 */
@RestController
@RequestMapping("/v1/patients")
@RequiredArgsConstructor
@Slf4j
public class PatientController {

    static final int MAX_PAGE_SIZE = 100;

    private final PatientAccessMediator accessMediator;
    private final PatientIngestionService ingestionService;
    private final PrincipalResolver principalResolver;
    private final ClientIpResolver clientIpResolver;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(
            @RequestPart("file") MultipartFile file,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId,
            HttpServletRequest request) throws IOException {

        try {
            AuthenticatedPrincipal principal = enter(request, correlationId);
            log.info("Received upload: file='{}', size={} bytes", file.getOriginalFilename(), file.getSize());

            IngestionResult result;
            try (InputStream content = file.getInputStream()) {
                result = ingestionService.ingest(principal.getId(), file.getOriginalFilename(), content,
                        clientIpResolver.resolveClientIp(request));
            }

            List<String> errors = result.getErrors().stream()
                    .map(RowError::toMessage)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(UploadResponse.builder()
                    .success(true)
                    .processedCount(result.getProcessedCount())
                    .errors(errors)
                    .build());
        } finally {
            MDC.clear();
        }
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<PatientDto>>> listPatients(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String search,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId,
            HttpServletRequest request) {

        try {
            AuthenticatedPrincipal principal = enter(request, correlationId);
            requireValidPaging(page, limit);

            DecryptedPatientPage result = accessMediator.listDecrypted(principal.getId(), search, page, limit,
                    clientIpResolver.resolveClientIp(request));
            if (result.getWithheld() > 0) {
                log.warn("{} patient record(s) withheld from list response", result.getWithheld());
            }
            return ResponseEntity.ok(ApiResponse.page(
                    result.getPatients(), result.getTotal(), result.getPage(), result.getLimit()));
        } finally {
            MDC.clear();
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<PatientDto>> getPatient(
            @PathVariable UUID id,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId,
            HttpServletRequest request) {

        try {
            AuthenticatedPrincipal principal = enter(request, correlationId);
            PatientDto patient = accessMediator.getDecrypted(principal.getId(), id,
                    clientIpResolver.resolveClientIp(request));
            return ResponseEntity.ok(ApiResponse.success(patient));
        } finally {
            MDC.clear();
        }
    }

    @PostMapping
    public ResponseEntity<ApiResponse<PatientDto>> createPatient(
            @Valid @RequestBody PatientCreateRequest body,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId,
            HttpServletRequest request) {

        try {
            AuthenticatedPrincipal principal = enter(request, correlationId);
            PatientDto patient = accessMediator.create(principal.getId(), body,
                    clientIpResolver.resolveClientIp(request));
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(ApiResponse.success(patient));
        } finally {
            MDC.clear();
        }
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ApiResponse<PatientDto>> updatePatient(
            @PathVariable UUID id,
            @RequestBody PatientUpdateRequest body,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId,
            HttpServletRequest request) {

        try {
            AuthenticatedPrincipal principal = enter(request, correlationId);
            PatientDto patient = accessMediator.edit(principal.getId(), id, body,
                    clientIpResolver.resolveClientIp(request));
            return ResponseEntity.ok(ApiResponse.success(patient));
        } finally {
            MDC.clear();
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<String>> deletePatient(
            @PathVariable UUID id,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId,
            HttpServletRequest request) {

        try {
            AuthenticatedPrincipal principal = enter(request, correlationId);
            accessMediator.delete(principal.getId(), id, clientIpResolver.resolveClientIp(request));
            return ResponseEntity.ok(ApiResponse.success("Patient record deleted"));
        } finally {
            MDC.clear();
        }
    }

    private AuthenticatedPrincipal enter(HttpServletRequest request, String correlationId) {
        MDC.put("correlationId", correlationId != null ? correlationId : UUID.randomUUID().toString());
        AuthenticatedPrincipal principal = principalResolver.resolve(request);
        MDC.put("principalId", principal.getId().toString());
        principal.requirePatientAccess();
        return principal;
    }

    private void requireValidPaging(int page, int limit) {
        if (page < 1) {
            throw new PatientValidationException("page must be at least 1", "page");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new PatientValidationException("limit must be between 1 and " + MAX_PAGE_SIZE, "limit");
        }
    }
}
