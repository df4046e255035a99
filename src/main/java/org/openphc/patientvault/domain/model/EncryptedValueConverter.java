package org.openphc.patientvault.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.openphc.patientvault.crypto.EncryptedValue;

/**
 * Maps an {@link EncryptedValue} to its base64 text column. Does not encrypt or decrypt.
 */
@Converter
public class EncryptedValueConverter implements AttributeConverter<EncryptedValue, String> {

    @Override
    public String convertToDatabaseColumn(EncryptedValue attribute) {
        return attribute != null ? attribute.getEncoded() : null;
    }

    @Override
    public EncryptedValue convertToEntityAttribute(String dbData) {
        return dbData != null ? EncryptedValue.of(dbData) : null;
    }
}
