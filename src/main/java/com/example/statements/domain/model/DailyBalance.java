package com.example.statements.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Aggregated activity of one statement day.
 *
 * @param date             calendar day
 * @param credits          sum of credits on the day
 * @param debits           sum of debits on the day, positive
 * @param closingBalance   balance after the day's last transaction carrying one
 * @param netChange        {@code credits - debits}
 * @param transactionCount transactions booked on the day
 */
public record DailyBalance(
        LocalDate date,
        BigDecimal credits,
        BigDecimal debits,
        BigDecimal closingBalance,
        BigDecimal netChange,
        int transactionCount
) {
}
