package org.openphc.patientvault.domain.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Patient fields that are only ever stored encrypted.
 */
@Getter
@RequiredArgsConstructor
public enum ProtectedField {
    FIRST_NAME("first_name", "First Name"),
    LAST_NAME("last_name", "Last Name"),
    DATE_OF_BIRTH("date_of_birth", "Date of Birth"),
    GENDER("gender", "Gender");

    private final String columnName;
    private final String label;
}
