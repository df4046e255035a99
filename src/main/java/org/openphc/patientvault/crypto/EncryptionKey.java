package org.openphc.patientvault.crypto;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Immutable AES-256 field encryption key, built once at start-up from configuration.
 * The raw key material is only reachable from this package and never appears in toString().
 */
public final class EncryptionKey {

    public static final int KEY_LENGTH_BYTES = 32;

    private final SecretKey secretKey;

    private EncryptionKey(byte[] raw) {
        if (raw.length != KEY_LENGTH_BYTES) {
            throw new IllegalArgumentException(
                    "Encryption key must be " + KEY_LENGTH_BYTES + " bytes, got " + raw.length);
        }
        this.secretKey = new SecretKeySpec(raw, "AES");
    }

    /**
     * Decode a standard base64 key (44 characters for 256 bits).
     */
    public static EncryptionKey fromBase64(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalArgumentException("Encryption key is not configured");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            // the decoder message may quote key characters
            throw new IllegalArgumentException("Encryption key is not valid base64");
        }
        try {
            return new EncryptionKey(raw);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    public static EncryptionKey of(byte[] raw) {
        return new EncryptionKey(raw.clone());
    }

    /**
     * Fresh random key, for tooling and tests.
     */
    public static EncryptionKey generate() {
        byte[] raw = new byte[KEY_LENGTH_BYTES];
        new SecureRandom().nextBytes(raw);
        return new EncryptionKey(raw);
    }

    SecretKey secretKey() {
        return secretKey;
    }

    @Override
    public String toString() {
        return "EncryptionKey[redacted]";
    }
}
