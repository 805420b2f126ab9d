package com.example.statements.domain.model;

/**
 * Node of the money-flow graph. Links reference nodes by their position in {@link FlowGraph#nodes()}.
 */
public record FlowNode(String name, FlowNodeCategory category) {
}
