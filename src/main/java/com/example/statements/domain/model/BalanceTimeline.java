package com.example.statements.domain.model;

import java.util.List;

/**
 * Daily balance series with statement statistics and key events.
 *
 * @param period     period the daily points are restricted to
 * @param days       daily points inside the period, ascending
 * @param statistics statistics over the whole statement
 * @param events     key events over the whole statement, ascending by date
 */
public record BalanceTimeline(
        String period,
        List<DailyBalance> days,
        TimelineStatistics statistics,
        List<TimelineEvent> events
) {
}
