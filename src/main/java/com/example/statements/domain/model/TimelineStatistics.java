package com.example.statements.domain.model;

import java.math.BigDecimal;

/**
 * Whole-statement statistics for the balance timeline.
 */
public record TimelineStatistics(
        BigDecimal startingBalance,
        BigDecimal endingBalance,
        BigDecimal totalCredits,
        BigDecimal totalDebits,
        BigDecimal netChange,
        int transactionCount
) {

    public static TimelineStatistics empty() {
        return new TimelineStatistics(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, 0);
    }
}
