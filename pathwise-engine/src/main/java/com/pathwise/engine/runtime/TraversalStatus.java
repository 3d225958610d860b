package com.pathwise.engine.runtime;

/**
 * Whole-traversal state.
 */
public enum TraversalStatus {
    /** On a start, decision or checkpoint node (routing in progress, or stalled there). */
    ROUTING,
    /** On a task node, waiting for tool output to verify. */
    AWAITING_OUTPUT,
    COMPLETED,
    ESCALATED,
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ESCALATED || this == EXPIRED;
    }
}
