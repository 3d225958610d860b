package com.pathwise.engine;

/**
 * What happened to the session's workflow on one turn.
 */
public enum TurnOutcome {
    /** No traversal and no plan matched. */
    INACTIVE,
    /** A plan matched and its traversal started. */
    ACTIVATED,
    /** An active traversal was advanced (or held in place) and is still running. */
    ADVANCED,
    /** Reached an exit node. */
    COMPLETED,
    /** Reached an escalate node. */
    ESCALATED,
    /** No transition within the staleness window. */
    EXPIRED,
    /** The plan or current node no longer resolves. */
    ABANDONED,
    /** Internal failure; the turn proceeds without workflow guidance. */
    PASSTHROUGH;

    /** True when the traversal has ended and the session no longer holds it. */
    public boolean endsTraversal() {
        return this == COMPLETED || this == ESCALATED || this == EXPIRED || this == ABANDONED;
    }
}
