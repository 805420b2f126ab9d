package com.example.statements.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;

/**
 * Domain DTO describing one extracted statement transaction.
 * The extractor supplies no identifier, so {@link #key()} is the only identity available for review matching.
 *
 * @param rawDate        date text exactly as extracted (may be blank or unparsable)
 * @param date           parsed date, {@code null} when {@code rawDate} could not be parsed
 * @param description    transaction narrative
 * @param amount         signed amount, negative for debits
 * @param balance        running balance, {@code null} when absent
 * @param category       extractor-assigned category, empty when absent
 * @param transferType   transfer classification, empty when absent
 * @param transferTarget counterparty label, empty when absent
 */
public record StatementTransaction(
        String rawDate,
        LocalDate date,
        String description,
        BigDecimal amount,
        BigDecimal balance,
        String category,
        String transferType,
        String transferTarget
) {

    public StatementTransaction {
        rawDate = rawDate == null ? "" : rawDate.trim();
        description = description == null ? "" : description.trim();
        amount = amount == null ? BigDecimal.ZERO : amount;
        category = category == null ? "" : category.trim();
        transferType = transferType == null ? "" : transferType.trim();
        transferTarget = transferTarget == null ? "" : transferTarget.trim();
    }

    /**
     * @return ISO date when parsable, otherwise the raw extracted text
     */
    public String displayDate() {
        return date != null ? date.toString() : rawDate;
    }

    public boolean isCredit() {
        return amount.signum() > 0;
    }

    public boolean isDebit() {
        return amount.signum() < 0;
    }

    /**
     * @return the year-month bucket of this transaction, empty when the date is unparsable
     */
    public Optional<YearMonth> yearMonth() {
        return Optional.ofNullable(date).map(YearMonth::from);
    }

    /**
     * Resolves the counterparty label used by flow aggregation.
     *
     * @param fallback label used when neither transfer target nor category is present
     * @return transfer target, else category, else {@code fallback}
     */
    public String counterpartyOr(String fallback) {
        if (!transferTarget.isEmpty()) {
            return transferTarget;
        }
        if (!category.isEmpty()) {
            return category;
        }
        return fallback;
    }

    /**
     * @return composite key used to attach review annotations
     */
    public TransactionKey key() {
        return TransactionKey.of(displayDate(), description, amount);
    }
}
