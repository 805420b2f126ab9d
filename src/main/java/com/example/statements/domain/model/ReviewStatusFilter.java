package com.example.statements.domain.model;

import java.util.Locale;

/**
 * Status filter offered by the review table.
 */
public enum ReviewStatusFilter {
    ALL,
    NONE,
    QUERY;

	/**
	 * Converts a request parameter into a filter. Blank or unknown values fall back to {@link #ALL}.
	 *
	 * @param rawValue string coming from the HTTP layer
	 * @return parsed filter
	 */
    public static ReviewStatusFilter fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return ALL;
        }
        try {
            return ReviewStatusFilter.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return ALL;
        }
    }

    public boolean matches(ReviewStatus status) {
        return switch (this) {
            case ALL -> true;
            case NONE -> status == ReviewStatus.NONE;
            case QUERY -> status == ReviewStatus.QUERY;
        };
    }
}
