package com.example.statements.domain.model;

import com.example.statements.domain.exception.InvalidFlowPeriodException;

import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Time window for flow aggregation and timelines: either the whole statement or a single calendar month.
 *
 * @param month selected month, {@code null} for the whole statement
 */
public record FlowPeriod(YearMonth month) {

    public static final String ALL_LABEL = "all";
    public static final FlowPeriod ALL = new FlowPeriod(null);

    private static final Pattern MONTH_PATTERN = Pattern.compile("\\d{4}-\\d{2}");

    /**
     * Parses {@code "all"} or {@code "YYYY-MM"}. A blank value means the whole statement.
     *
     * @param rawValue period requested by the caller
     * @return parsed period
     * @throws InvalidFlowPeriodException when the value is neither form
     */
    public static FlowPeriod parse(String rawValue) {
        if (rawValue == null || rawValue.isBlank() || ALL_LABEL.equalsIgnoreCase(rawValue.trim())) {
            return ALL;
        }
        String trimmed = rawValue.trim();
        if (!MONTH_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidFlowPeriodException(trimmed);
        }
        try {
            return new FlowPeriod(YearMonth.parse(trimmed));
        } catch (DateTimeParseException ex) {
            throw new InvalidFlowPeriodException(trimmed);
        }
    }

    public boolean isAll() {
        return month == null;
    }

    /**
     * Transactions with unparsable dates only belong to {@link #ALL}.
     *
     * @param transaction candidate transaction
     * @return whether the transaction falls inside this period
     */
    public boolean includes(StatementTransaction transaction) {
        if (isAll()) {
            return true;
        }
        return transaction.yearMonth().map(month::equals).orElse(false);
    }

    public String label() {
        return isAll() ? ALL_LABEL : month.toString();
    }
}
