package com.example.statements.domain.model;

/**
 * Kinds of key events detected on a balance timeline.
 */
public enum TimelineEventType {
    WENT_NEGATIVE("Account went negative"),
    LARGE_SPENDING("Large spending day"),
    LARGE_DEPOSIT("Large deposit received");

    private final String label;

    TimelineEventType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
