package org.openphc.patientvault.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.openphc.patientvault.api.dto.PatientCreateRequest;
import org.openphc.patientvault.api.dto.PatientDto;
import org.openphc.patientvault.api.dto.PatientUpdateRequest;
import org.openphc.patientvault.config.EncryptionConfig;
import org.openphc.patientvault.crypto.FieldCipher;
import org.openphc.patientvault.domain.model.AuditLogEntry;
import org.openphc.patientvault.domain.model.PatientRecord;
import org.openphc.patientvault.domain.model.enums.AuditAction;
import org.openphc.patientvault.domain.repository.AuditLogEntryRepository;
import org.openphc.patientvault.domain.repository.JpaManagerScopedPatientRepository;
import org.openphc.patientvault.domain.repository.PatientRecordRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the encrypted patient flow against H2: create, list, edit and
 * audit, with real encryption and the real scoped repository.
 */
@DataJpaTest
@Import({
        JpaManagerScopedPatientRepository.class,
        FieldCipher.class,
        EncryptionConfig.class,
        PatientRecordEncryptor.class,
        PatientRecordValidator.class,
        AuditLogger.class,
        PatientAccessMediator.class,
        PatientVaultFlowTest.Metrics.class
})
class PatientVaultFlowTest {

    private static final UUID MANAGER_A = UUID.fromString("aaaaaaaa-1111-1111-1111-000000000001");
    private static final UUID MANAGER_B = UUID.fromString("bbbbbbbb-2222-2222-2222-000000000002");
    private static final String CLIENT_IP = "192.168.1.20";

    @TestConfiguration
    static class Metrics {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private PatientAccessMediator mediator;

    @Autowired
    private AuditLogger auditLogger;

    @Autowired
    private PatientRecordRepository patientRecordRepository;

    @Autowired
    private AuditLogEntryRepository auditLogEntryRepository;

    private static PatientCreateRequest jane(String patientId) {
        return PatientCreateRequest.builder()
                .patientId(patientId)
                .firstName("Jane")
                .lastName("Doe")
                .dateOfBirth("1990-01-01")
                .gender("Female")
                .build();
    }

    @Test
    void shouldStoreCiphertextAndServePlaintextOnlyToOwner() {
        PatientDto created = mediator.create(MANAGER_A, jane("PT-001"), CLIENT_IP);
        mediator.create(MANAGER_A, jane("PT-002"), CLIENT_IP);

        PatientRecord stored = patientRecordRepository.findById(created.getId()).orElseThrow();
        PatientRecord other = patientRecordRepository.findAll().stream()
                .filter(r -> "PT-002".equals(r.getPatientId()))
                .findFirst()
                .orElseThrow();
        String storedFirstName = stored.getFirstName().getEncoded();
        assertNotEquals("Jane", storedFirstName);
        assertFalse(new String(Base64.getDecoder().decode(storedFirstName), StandardCharsets.ISO_8859_1)
                .contains("Jane"));
        assertNotEquals(storedFirstName, other.getFirstName().getEncoded());

        List<PatientDto> ownList = mediator.listDecrypted(MANAGER_A, null, 1, 20, CLIENT_IP).getPatients();
        PatientDto listed = ownList.stream()
                .filter(p -> "PT-001".equals(p.getPatientId()))
                .findFirst()
                .orElseThrow();
        assertEquals("Jane", listed.getFirstName());

        List<PatientDto> otherList = mediator.listDecrypted(MANAGER_B, null, 1, 20, CLIENT_IP).getPatients();
        assertTrue(otherList.stream().noneMatch(p -> "PT-001".equals(p.getPatientId())));
    }

    @Test
    void shouldAuditEveryOperationWithoutPlaintext() {
        PatientDto created = mediator.create(MANAGER_A, jane("PT-010"), CLIENT_IP);
        mediator.listDecrypted(MANAGER_A, null, 1, 20, CLIENT_IP);
        mediator.getDecrypted(MANAGER_A, created.getId(), CLIENT_IP);
        mediator.edit(MANAGER_A, created.getId(), PatientUpdateRequest.builder().lastName("Roe").build(), CLIENT_IP);
        mediator.delete(MANAGER_A, created.getId(), CLIENT_IP);

        assertEquals(1, auditLogEntryRepository.countByAction(AuditAction.UPLOAD));
        assertEquals(2, auditLogEntryRepository.countByAction(AuditAction.ACCESS));
        assertEquals(1, auditLogEntryRepository.countByAction(AuditAction.EDIT));
        assertEquals(1, auditLogEntryRepository.countByAction(AuditAction.DELETE));

        AuditPage trail = auditLogger.query(MANAGER_A, 1, 50, null);
        assertEquals(5, trail.getTotal());
        assertEquals(AuditAction.DELETE, trail.getEntries().get(0).getAction());
        for (AuditLogEntry entry : trail.getEntries()) {
            assertEquals(CLIENT_IP, entry.getClientIp());
            String details = entry.getDetails() != null ? entry.getDetails() : "";
            assertFalse(details.contains("Jane"), details);
            assertFalse(details.contains("Roe"), details);
            assertFalse(details.contains("1990-01-01"), details);
        }
    }

    @Test
    void shouldKeepUntouchedFieldsDecryptableAfterEdit() {
        PatientDto created = mediator.create(MANAGER_A, jane("PT-020"), CLIENT_IP);

        mediator.edit(MANAGER_A, created.getId(), PatientUpdateRequest.builder().gender("o").build(), CLIENT_IP);
        PatientDto reread = mediator.getDecrypted(MANAGER_A, created.getId(), CLIENT_IP);

        assertEquals("Other", reread.getGender());
        assertEquals("Jane", reread.getFirstName());
        assertEquals("Doe", reread.getLastName());
        assertEquals("1990-01-01", reread.getDateOfBirth());
    }

    @Test
    void shouldHideEntriesAppendedAfterSnapshot() {
        mediator.create(MANAGER_A, jane("PT-030"), CLIENT_IP);
        mediator.create(MANAGER_A, jane("PT-031"), CLIENT_IP);
        AuditPage first = auditLogger.query(MANAGER_A, 1, 1, null);

        mediator.create(MANAGER_A, jane("PT-032"), CLIENT_IP);
        AuditPage second = auditLogger.query(MANAGER_A, 2, 1, first.getSnapshotId());

        assertEquals(2, first.getTotal());
        assertEquals(2, second.getTotal());
        assertTrue(second.getEntries().get(0).getId() <= first.getSnapshotId());
        assertTrue(second.getEntries().get(0).getDetails().contains("PT-030"));
    }
}
