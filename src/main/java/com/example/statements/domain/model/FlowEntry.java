package com.example.statements.domain.model;

import java.math.BigDecimal;

/**
 * One counterparty total with its share of the relevant credit or debit total.
 *
 * @param label      counterparty label
 * @param amount     aggregated amount, always positive
 * @param percentage share of the total in percent, {@code 0} when the total is zero
 */
public record FlowEntry(String label, BigDecimal amount, BigDecimal percentage) {
}
