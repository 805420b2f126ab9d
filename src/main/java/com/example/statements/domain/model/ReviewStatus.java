package com.example.statements.domain.model;

import java.util.Locale;

/**
 * Review state a reviewer can put a transaction in.
 */
public enum ReviewStatus {
    NONE,
    QUERY;

    /**
     * Parses a wire value, accepting any letter case.
     *
     * @param rawValue value supplied by the caller
     * @return parsed status or {@code null} when the value is blank or unknown
     */
    public static ReviewStatus fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return null;
        }
        try {
            return ReviewStatus.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
