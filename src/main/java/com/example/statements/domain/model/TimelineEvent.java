package com.example.statements.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Noteworthy day on the balance timeline.
 *
 * @param date    day of the event
 * @param type    event kind
 * @param label   human readable description of the kind
 * @param balance closing balance of the day, {@code null} when unknown
 */
public record TimelineEvent(LocalDate date, TimelineEventType type, String label, BigDecimal balance) {

    public static TimelineEvent of(LocalDate date, TimelineEventType type, BigDecimal balance) {
        return new TimelineEvent(date, type, type.label(), balance);
    }
}
