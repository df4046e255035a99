package org.openphc.patientvault.crypto;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.openphc.patientvault.api.exception.IntegrityException;

import java.util.Base64;
import java.util.Objects;

/**
 * Opaque field ciphertext: standard base64 of {@code nonce || ciphertext || tag}.
 * Safe to store in a text column.
 */
@Getter
@EqualsAndHashCode
public final class EncryptedValue {

    /** Column width for one field: fits a 100-character value in 4-byte UTF-8. */
    public static final int MAX_COLUMN_LENGTH = 1024;

    private final String encoded;

    private EncryptedValue(String encoded) {
        this.encoded = encoded;
    }

    public static EncryptedValue of(String encoded) {
        return new EncryptedValue(Objects.requireNonNull(encoded, "encoded"));
    }

    static EncryptedValue fromBytes(byte[] blob) {
        return new EncryptedValue(Base64.getEncoder().encodeToString(blob));
    }

    byte[] toBytes() {
        try {
            return Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("Encrypted value is not valid base64", e);
        }
    }

    @Override
    public String toString() {
        return "EncryptedValue[" + encoded.length() + " chars]";
    }
}
