package com.example.statements.domain.model;

/**
 * Where the amounts of a {@link FlowGraph} came from.
 */
public enum FlowSource {
    /** Pre-aggregated inflow/outflow totals supplied by the extractor. */
    EXPLICIT_TOTALS,
    /** Totals aggregated from individual transactions. */
    TRANSACTIONS
}
