package com.example.statements.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Summary statistics accompanying a money-flow graph.
 *
 * @param totalCredits   sum of all inflows
 * @param totalDebits    sum of all outflows
 * @param netPosition    {@code totalCredits - totalDebits}
 * @param topInflows     largest inflows, descending
 * @param topOutflows    largest outflows, descending
 * @param largestInflow  first of {@code topInflows}, {@code null} when there are no inflows
 * @param largestOutflow first of {@code topOutflows}, {@code null} when there are no outflows
 */
public record FlowSummary(
        BigDecimal totalCredits,
        BigDecimal totalDebits,
        BigDecimal netPosition,
        List<FlowEntry> topInflows,
        List<FlowEntry> topOutflows,
        FlowEntry largestInflow,
        FlowEntry largestOutflow
) {

    public FlowSummary(BigDecimal totalCredits, BigDecimal totalDebits, BigDecimal netPosition,
                       List<FlowEntry> topInflows, List<FlowEntry> topOutflows) {
        this(totalCredits, totalDebits, netPosition, topInflows, topOutflows,
                topInflows.isEmpty() ? null : topInflows.get(0),
                topOutflows.isEmpty() ? null : topOutflows.get(0));
    }
}
