package com.example.statements.domain.model;

import java.util.List;

/**
 * Three-tier money-flow graph: inflow sources, then the account node, then outflow targets.
 * Node order is part of the contract because visualizations address nodes by position.
 *
 * @param period  period the graph was computed for
 * @param source  origin of the amounts
 * @param nodes   ordered nodes
 * @param links   weighted links between node positions
 * @param summary totals and top entries
 */
public record FlowGraph(
        String period,
        FlowSource source,
        List<FlowNode> nodes,
        List<FlowLink> links,
        FlowSummary summary
) {
}
