package com.example.statements.domain.model;

/**
 * Tier of a node in the money-flow graph.
 */
public enum FlowNodeCategory {
    INFLOW,
    ACCOUNT,
    OUTFLOW
}
