package org.openphc.patientvault.crypto;

import org.openphc.patientvault.api.exception.IntegrityException;
import org.springframework.stereotype.Component;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * AES-256-GCM encryption of single field values.
 *
 * <p>Every call draws a fresh 96-bit nonce, so encrypting the same plaintext twice
 * yields different blobs. Decryption verifies the 128-bit tag and never returns
 * unauthenticated plaintext. The key is passed in per call and never retained.
 */
@Component
public class FieldCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    static final int NONCE_LENGTH_BYTES = 12;
    static final int TAG_LENGTH_BITS = 128;
    private static final int TAG_LENGTH_BYTES = TAG_LENGTH_BITS / 8;

    // SecureRandom is thread-safe
    private final SecureRandom secureRandom = new SecureRandom();

    public EncryptedValue encrypt(byte[] plaintext, EncryptionKey key) {
        Objects.requireNonNull(plaintext, "plaintext");
        Objects.requireNonNull(key, "key");

        byte[] nonce = new byte[NONCE_LENGTH_BYTES];
        secureRandom.nextBytes(nonce);

        byte[] sealed;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key.secretKey(), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            sealed = cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }

        // sealed already carries ciphertext || tag
        byte[] blob = new byte[NONCE_LENGTH_BYTES + sealed.length];
        System.arraycopy(nonce, 0, blob, 0, NONCE_LENGTH_BYTES);
        System.arraycopy(sealed, 0, blob, NONCE_LENGTH_BYTES, sealed.length);
        return EncryptedValue.fromBytes(blob);
    }

    public byte[] decrypt(EncryptedValue value, EncryptionKey key) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(key, "key");

        byte[] blob = value.toBytes();
        if (blob.length < NONCE_LENGTH_BYTES + TAG_LENGTH_BYTES) {
            throw new IntegrityException("Encrypted value is truncated");
        }

        Cipher cipher;
        try {
            cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key.secretKey(),
                    new GCMParameterSpec(TAG_LENGTH_BITS, blob, 0, NONCE_LENGTH_BYTES));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption unavailable", e);
        }

        try {
            return cipher.doFinal(blob, NONCE_LENGTH_BYTES, blob.length - NONCE_LENGTH_BYTES);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            // AEADBadTagException: tampered, corrupted or encrypted under another key
            throw new IntegrityException("Authentication tag verification failed", e);
        }
    }

    public EncryptedValue encryptText(String plaintext, EncryptionKey key) {
        Objects.requireNonNull(plaintext, "plaintext");
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
    }

    public String decryptText(EncryptedValue value, EncryptionKey key) {
        return new String(decrypt(value, key), StandardCharsets.UTF_8);
    }
}
