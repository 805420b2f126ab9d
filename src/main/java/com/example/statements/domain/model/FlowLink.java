package com.example.statements.domain.model;

import java.math.BigDecimal;

/**
 * Weighted directed edge between two node positions of a {@link FlowGraph}.
 */
public record FlowLink(int source, int target, BigDecimal value) {
}
