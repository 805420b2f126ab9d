package com.example.statements.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Domain DTO holding the structured extraction output for one bank statement.
 * Construction normalizes the transaction order to ascending date; undated transactions sort last in their
 * original relative order.
 *
 * @param institution      financial institution name
 * @param accountHolders   account holders in extraction order
 * @param accountType      account type label
 * @param periodStart      statement start, {@code null} when unknown
 * @param periodEnd        statement end, {@code null} when unknown
 * @param accountNumber    account number, empty when absent
 * @param bsb              BSB or sort code, empty when absent
 * @param currency         currency code
 * @param totalCredits     credit total reported by extraction
 * @param totalDebits      debit total reported by extraction
 * @param transactions     date-normalized transactions
 * @param explicitInflows  pre-aggregated inflows by counterparty, empty when not supplied
 * @param explicitOutflows pre-aggregated outflows by counterparty, empty when not supplied
 * @param summary          free-text analysis narrative
 */
public record CanonicalStatement(
        String institution,
        List<String> accountHolders,
        String accountType,
        LocalDate periodStart,
        LocalDate periodEnd,
        String accountNumber,
        String bsb,
        String currency,
        BigDecimal totalCredits,
        BigDecimal totalDebits,
        List<StatementTransaction> transactions,
        Map<String, BigDecimal> explicitInflows,
        Map<String, BigDecimal> explicitOutflows,
        String summary
) {

    private static final Comparator<StatementTransaction> BY_DATE = Comparator.comparing(
            StatementTransaction::date, Comparator.nullsLast(Comparator.naturalOrder()));

    public CanonicalStatement {
        institution = nullToEmpty(institution);
        accountHolders = accountHolders == null ? List.of() : List.copyOf(accountHolders);
        accountType = nullToEmpty(accountType);
        accountNumber = nullToEmpty(accountNumber);
        bsb = nullToEmpty(bsb);
        currency = nullToEmpty(currency);
        totalCredits = totalCredits == null ? BigDecimal.ZERO : totalCredits;
        totalDebits = totalDebits == null ? BigDecimal.ZERO : totalDebits;
        transactions = sortByDate(transactions);
        explicitInflows = copyOrdered(explicitInflows);
        explicitOutflows = copyOrdered(explicitOutflows);
        summary = nullToEmpty(summary);
    }

    /**
     * @return a statement with no metadata and no transactions
     */
    public static CanonicalStatement empty() {
        return new CanonicalStatement(null, null, null, null, null, null, null, null,
                null, null, null, null, null, null);
    }

    public boolean hasExplicitFlows() {
        return !explicitInflows.isEmpty() || !explicitOutflows.isEmpty();
    }

    public boolean isEmpty() {
        return transactions.isEmpty() && !hasExplicitFlows();
    }

    private static List<StatementTransaction> sortByDate(List<StatementTransaction> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        List<StatementTransaction> sorted = new ArrayList<>(source);
        // List.sort is stable, so same-day transactions keep their extraction order
        sorted.sort(BY_DATE);
        return Collections.unmodifiableList(sorted);
    }

    private static Map<String, BigDecimal> copyOrdered(Map<String, BigDecimal> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
