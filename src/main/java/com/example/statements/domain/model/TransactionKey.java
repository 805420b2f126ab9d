package com.example.statements.domain.model;

import java.math.BigDecimal;

/**
 * Composite identity {@code (date, description, amount)} shared by a transaction and its review annotation.
 * Amounts are held in canonical form so {@code -500.00} and {@code -500} produce the same key.
 */
public record TransactionKey(String date, String description, String amount) {

    public TransactionKey {
        date = date == null ? "" : date.trim();
        description = description == null ? "" : description.trim();
        amount = amount == null ? "0" : amount;
    }

    /**
     * Builds a key from a decimal amount.
     *
     * @param date        ISO or raw date text
     * @param description transaction narrative
     * @param amount      signed amount
     * @return normalized key
     */
    public static TransactionKey of(String date, String description, BigDecimal amount) {
        return new TransactionKey(date, description, canonicalAmount(amount));
    }

    /**
     * @param amount signed amount, may be {@code null}
     * @return plain-notation amount without trailing zeros
     */
    public static String canonicalAmount(BigDecimal amount) {
        if (amount == null || amount.signum() == 0) {
            return "0";
        }
        return amount.stripTrailingZeros().toPlainString();
    }

    public BigDecimal amountValue() {
        return new BigDecimal(amount);
    }
}
