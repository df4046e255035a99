package org.openphc.patientvault.domain.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Closed set of accepted gender values. Stored in display form.
 */
@Getter
@RequiredArgsConstructor
public enum Gender {
    MALE("Male", "M"),
    FEMALE("Female", "F"),
    OTHER("Other", "O"),
    UNKNOWN("Unknown", "U");

    private final String displayName;
    private final String code;

    /**
     * Match a display name or one-letter code, case-insensitively.
     */
    public static Optional<Gender> fromInput(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(g -> g.name().equals(value) || g.code.equals(value))
                .findFirst();
    }

    public static String allowedValues() {
        return Arrays.stream(values())
                .map(Gender::getDisplayName)
                .collect(Collectors.joining(", "));
    }
}
