package org.openphc.patientvault.config;

import lombok.extern.slf4j.Slf4j;
import org.openphc.patientvault.crypto.EncryptionKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the field encryption key once at start-up. A missing or malformed key
 * stops the application.
 */
@Configuration
@Slf4j
public class EncryptionConfig {

    @Bean
    public EncryptionKey encryptionKey(@Value("${patientvault.encryption.key:}") String encodedKey) {
        EncryptionKey key = EncryptionKey.fromBase64(encodedKey);
        log.info("Field encryption key loaded (AES-{})", EncryptionKey.KEY_LENGTH_BYTES * 8);
        return key;
    }
}
