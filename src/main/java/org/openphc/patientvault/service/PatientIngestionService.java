package org.openphc.patientvault.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.openphc.patientvault.api.exception.DuplicatePatientException;
import org.openphc.patientvault.api.exception.SpreadsheetParseException;
import org.openphc.patientvault.domain.model.PatientRecord;
import org.openphc.patientvault.domain.model.enums.AuditAction;
import org.openphc.patientvault.domain.repository.ManagerScopedPatientRepository;
import org.openphc.patientvault.ingest.PatientRow;
import org.openphc.patientvault.ingest.SpreadsheetParser;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.List;
import java.util.UUID;

/**
 * Batch upload orchestrator: parse → validate → encrypt → persist, row by row.
 *
 * <p>Not transactional: each row commits on its own, and committed rows stay committed.
 * Exactly one UPLOAD audit entry is written per call, including when the file cannot
 * be parsed.
 */
@Service
@Slf4j
public class PatientIngestionService {

    private final SpreadsheetParser spreadsheetParser;
    private final PatientRecordValidator validator;
    private final PatientRecordEncryptor recordEncryptor;
    private final ManagerScopedPatientRepository patientRepository;
    private final AuditLogger auditLogger;

    // Metrics
    private final Timer ingestionTimer;
    private final MeterRegistry meterRegistry;

    public PatientIngestionService(
            SpreadsheetParser spreadsheetParser,
            PatientRecordValidator validator,
            PatientRecordEncryptor recordEncryptor,
            ManagerScopedPatientRepository patientRepository,
            AuditLogger auditLogger,
            MeterRegistry meterRegistry) {
        this.spreadsheetParser = spreadsheetParser;
        this.validator = validator;
        this.recordEncryptor = recordEncryptor;
        this.patientRepository = patientRepository;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
        this.ingestionTimer = Timer.builder("patientvault.ingestion.duration")
                .description("End-to-end spreadsheet upload latency")
                .register(meterRegistry);
    }

    /**
     * Ingest an uploaded spreadsheet on behalf of a manager, who becomes the owner of
     * every stored row.
     *
     * @throws SpreadsheetParseException if the file as a whole cannot be read
     */
    public IngestionResult ingest(UUID managerId, String fileName, InputStream content, String clientIp) {
        return ingestionTimer.record(() -> doIngest(managerId, fileName, content, clientIp));
    }

    private IngestionResult doIngest(UUID managerId, String fileName, InputStream content, String clientIp) {
        List<PatientRow> rows;
        try {
            rows = spreadsheetParser.parse(fileName, content);
        } catch (SpreadsheetParseException e) {
            auditLogger.record(AuditAction.UPLOAD, managerId, null,
                    String.format("Upload of '%s' rejected: %s", fileName, e.getMessage()), clientIp);
            throw e;
        }

        IngestionResult.IngestionResultBuilder result = IngestionResult.builder().totalRows(rows.size());
        int processed = 0;
        int failed = 0;

        for (PatientRow row : rows) {
            RowValidationResult validation = validator.validate(row);
            if (!validation.isValid()) {
                result.error(new RowError(row.getRowNumber(), validation.getError()));
                recordRow("invalid");
                failed++;
                continue;
            }

            ValidatedPatient patient = validation.getPatient();
            try {
                PatientRecord record = recordEncryptor.encryptNew(patient, managerId);
                patientRepository.insert(record);
                recordRow("stored");
                processed++;
            } catch (DuplicatePatientException e) {
                result.error(new RowError(row.getRowNumber(),
                        "Duplicate Patient ID '" + patient.getPatientId() + "'"));
                recordRow("duplicate");
                failed++;
            }
        }

        auditLogger.record(AuditAction.UPLOAD, managerId, null,
                String.format("Uploaded %d of %d rows from '%s' (%d errors)",
                        processed, rows.size(), fileName, failed), clientIp);
        log.info("Upload processed: file='{}', total={}, stored={}, errors={}",
                fileName, rows.size(), processed, failed);

        return result.processedCount(processed).build();
    }

    private void recordRow(String outcome) {
        Counter.builder("patientvault.ingestion.rows")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
