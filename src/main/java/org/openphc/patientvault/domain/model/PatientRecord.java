package org.openphc.patientvault.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.openphc.patientvault.crypto.EncryptedValue;
import org.openphc.patientvault.domain.model.enums.ProtectedField;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Patient row. The four protected fields hold ciphertext only; patient_id stays
 * plaintext as the global business key. Id, owner and creation time are fixed at insert
 * and have no setters.
 */
@Entity
@Table(name = "patient_record",
        indexes = @Index(name = "idx_patient_record_owner", columnList = "owner_manager_id"))
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PatientRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Setter
    @Column(name = "patient_id", nullable = false, unique = true, length = 64)
    private String patientId;

    @Convert(converter = EncryptedValueConverter.class)
    @Column(name = "first_name", nullable = false, length = EncryptedValue.MAX_COLUMN_LENGTH)
    @Setter
    private EncryptedValue firstName;

    @Convert(converter = EncryptedValueConverter.class)
    @Column(name = "last_name", nullable = false, length = EncryptedValue.MAX_COLUMN_LENGTH)
    @Setter
    private EncryptedValue lastName;

    @Convert(converter = EncryptedValueConverter.class)
    @Column(name = "date_of_birth", nullable = false, length = EncryptedValue.MAX_COLUMN_LENGTH)
    @Setter
    private EncryptedValue dateOfBirth;

    @Convert(converter = EncryptedValueConverter.class)
    @Column(name = "gender", nullable = false, length = EncryptedValue.MAX_COLUMN_LENGTH)
    @Setter
    private EncryptedValue gender;

    @Column(name = "owner_manager_id", nullable = false, updatable = false)
    private UUID ownerManagerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now(ZoneOffset.UTC);

    @Setter
    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private OffsetDateTime updatedAt = OffsetDateTime.now(ZoneOffset.UTC);

    public EncryptedValue getProtectedField(ProtectedField field) {
        switch (field) {
            case FIRST_NAME:
                return firstName;
            case LAST_NAME:
                return lastName;
            case DATE_OF_BIRTH:
                return dateOfBirth;
            case GENDER:
                return gender;
            default:
                throw new IllegalArgumentException("Unknown protected field: " + field);
        }
    }

    public void setProtectedField(ProtectedField field, EncryptedValue value) {
        switch (field) {
            case FIRST_NAME:
                firstName = value;
                break;
            case LAST_NAME:
                lastName = value;
                break;
            case DATE_OF_BIRTH:
                dateOfBirth = value;
                break;
            case GENDER:
                gender = value;
                break;
            default:
                throw new IllegalArgumentException("Unknown protected field: " + field);
        }
    }
}
