package org.openphc.patientvault.domain.repository;

import org.junit.jupiter.api.Test;
import org.openphc.patientvault.api.exception.DuplicatePatientException;
import org.openphc.patientvault.api.exception.PatientAccessDeniedException;
import org.openphc.patientvault.api.exception.PatientNotFoundException;
import org.openphc.patientvault.crypto.EncryptedValue;
import org.openphc.patientvault.domain.model.PatientRecord;
import org.openphc.patientvault.domain.model.PatientRecordPatch;
import org.openphc.patientvault.domain.model.enums.ProtectedField;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Page;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Repository tests for JpaManagerScopedPatientRepository on H2.
 */
@DataJpaTest
@Import(JpaManagerScopedPatientRepository.class)
class JpaManagerScopedPatientRepositoryTest {

    private static final UUID MANAGER_A = UUID.fromString("aaaaaaaa-0000-0000-0000-000000000001");
    private static final UUID MANAGER_B = UUID.fromString("bbbbbbbb-0000-0000-0000-000000000002");
    private static final OffsetDateTime BASE_TIME = OffsetDateTime.of(2024, 1, 1, 8, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private ManagerScopedPatientRepository repository;

    private PatientRecord record(String patientId, UUID owner, int minutesAfterBase) {
        OffsetDateTime createdAt = BASE_TIME.plusMinutes(minutesAfterBase);
        return PatientRecord.builder()
                .patientId(patientId)
                .firstName(EncryptedValue.of("Zmlyc3Q="))
                .lastName(EncryptedValue.of("bGFzdA=="))
                .dateOfBirth(EncryptedValue.of("ZG9i"))
                .gender(EncryptedValue.of("Z2VuZGVy"))
                .ownerManagerId(owner)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }

    private static List<String> patientIds(Page<PatientRecord> page) {
        return page.getContent().stream().map(PatientRecord::getPatientId).collect(Collectors.toList());
    }

    @Test
    void shouldListOnlyOwnRecordsNewestFirst() {
        repository.insert(record("PT-001", MANAGER_A, 1));
        repository.insert(record("PT-002", MANAGER_B, 2));
        repository.insert(record("PT-003", MANAGER_A, 3));

        Page<PatientRecord> pageA = repository.findByOwner(MANAGER_A, null, 1, 20);
        Page<PatientRecord> pageB = repository.findByOwner(MANAGER_B, null, 1, 20);

        assertEquals(List.of("PT-003", "PT-001"), patientIds(pageA));
        assertEquals(2, pageA.getTotalElements());
        assertEquals(List.of("PT-002"), patientIds(pageB));
    }

    @Test
    void shouldSearchPatientIdCaseInsensitivelyWithinScope() {
        repository.insert(record("ABC-100", MANAGER_A, 1));
        repository.insert(record("XYZ-200", MANAGER_A, 2));
        repository.insert(record("abc-300", MANAGER_B, 3));

        Page<PatientRecord> result = repository.findByOwner(MANAGER_A, "abc", 1, 20);

        assertEquals(List.of("ABC-100"), patientIds(result));
    }

    @Test
    void shouldPageWithOneBasedPageNumbers() {
        for (int i = 1; i <= 5; i++) {
            repository.insert(record("PT-00" + i, MANAGER_A, i));
        }

        Page<PatientRecord> second = repository.findByOwner(MANAGER_A, null, 2, 2);

        assertEquals(List.of("PT-003", "PT-002"), patientIds(second));
        assertEquals(5, second.getTotalElements());
    }

    @Test
    void shouldRejectNonPositivePaging() {
        assertThrows(IllegalArgumentException.class, () -> repository.findByOwner(MANAGER_A, null, 0, 20));
        assertThrows(IllegalArgumentException.class, () -> repository.findByOwner(MANAGER_A, null, 1, 0));
    }

    @Test
    void shouldEnforceGlobalPatientIdUniqueness() {
        repository.insert(record("PT-001", MANAGER_A, 1));

        DuplicatePatientException ex = assertThrows(DuplicatePatientException.class,
                () -> repository.insert(record("PT-001", MANAGER_B, 2)));
        assertEquals("PT-001", ex.getPatientId());
    }

    @Test
    void shouldDistinguishMissingFromForeignRecords() {
        PatientRecord owned = repository.insert(record("PT-001", MANAGER_A, 1));

        assertEquals("PT-001", repository.findOwned(MANAGER_A, owned.getId()).getPatientId());
        assertThrows(PatientAccessDeniedException.class, () -> repository.findOwned(MANAGER_B, owned.getId()));
        assertThrows(PatientNotFoundException.class, () -> repository.findOwned(MANAGER_A, UUID.randomUUID()));
    }

    @Test
    void shouldApplyOnlyPatchedFields() {
        PatientRecord owned = repository.insert(record("PT-001", MANAGER_A, 1));
        EncryptedValue newFirstName = EncryptedValue.of("bmV3");

        PatientRecord updated = repository.update(owned.getId(), MANAGER_A, PatientRecordPatch.builder()
                .encryptedField(ProtectedField.FIRST_NAME, newFirstName)
                .build());

        assertEquals(newFirstName, updated.getFirstName());
        assertEquals(EncryptedValue.of("bGFzdA=="), updated.getLastName());
        assertEquals("PT-001", updated.getPatientId());
        assertTrue(updated.getUpdatedAt().isAfter(BASE_TIME.plusMinutes(1)));
    }

    @Test
    void shouldStampTimestampsInUtcByDefault() {
        PatientRecord inserted = repository.insert(PatientRecord.builder()
                .patientId("PT-050")
                .firstName(EncryptedValue.of("Zmlyc3Q="))
                .lastName(EncryptedValue.of("bGFzdA=="))
                .dateOfBirth(EncryptedValue.of("ZG9i"))
                .gender(EncryptedValue.of("Z2VuZGVy"))
                .ownerManagerId(MANAGER_A)
                .build());

        assertEquals(ZoneOffset.UTC, inserted.getCreatedAt().getOffset());
        assertEquals(ZoneOffset.UTC, inserted.getUpdatedAt().getOffset());
    }

    @Test
    void shouldKeepIdentityAndOwnershipColumnsWithoutSetters() {
        assertThrows(NoSuchMethodException.class, () -> PatientRecord.class.getMethod("setId", UUID.class));
        assertThrows(NoSuchMethodException.class, () -> PatientRecord.class.getMethod("setOwnerManagerId", UUID.class));
        assertThrows(NoSuchMethodException.class, () -> PatientRecord.class.getMethod("setCreatedAt", OffsetDateTime.class));
    }

    @Test
    void shouldRenamePatientIdUnlessTaken() {
        PatientRecord first = repository.insert(record("PT-001", MANAGER_A, 1));
        repository.insert(record("PT-002", MANAGER_B, 2));

        assertThrows(DuplicatePatientException.class, () -> repository.update(first.getId(), MANAGER_A,
                PatientRecordPatch.builder().patientId("PT-002").build()));

        PatientRecord renamed = repository.update(first.getId(), MANAGER_A,
                PatientRecordPatch.builder().patientId("PT-009").build());
        assertEquals("PT-009", renamed.getPatientId());
    }

    @Test
    void shouldNotUpdateOrDeleteAnotherManagersRecord() {
        PatientRecord owned = repository.insert(record("PT-001", MANAGER_A, 1));

        assertThrows(PatientAccessDeniedException.class, () -> repository.update(owned.getId(), MANAGER_B,
                PatientRecordPatch.builder().patientId("PT-777").build()));
        assertThrows(PatientAccessDeniedException.class, () -> repository.delete(owned.getId(), MANAGER_B));
        assertEquals("PT-001", repository.findOwned(MANAGER_A, owned.getId()).getPatientId());
    }

    @Test
    void shouldDeleteOwnedRecord() {
        PatientRecord owned = repository.insert(record("PT-001", MANAGER_A, 1));

        repository.delete(owned.getId(), MANAGER_A);

        assertThrows(PatientNotFoundException.class, () -> repository.findOwned(MANAGER_A, owned.getId()));
    }
}
