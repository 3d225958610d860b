package com.pathwise.engine.runtime;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;

/**
 * Mutable record of the current visit to a node: outcome and verification attempts.
 * Replaced with a fresh pending visit whenever traversal re-enters the node.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE)
public final class NodeVisit {

    private VisitOutcome outcome;
    private int attempts;

    public NodeVisit() {
        this.outcome = VisitOutcome.PENDING;
        this.attempts = 0;
    }

    public static NodeVisit pending() {
        return new NodeVisit();
    }

    public VisitOutcome getOutcome() {
        return outcome;
    }

    public void setOutcome(VisitOutcome outcome) {
        this.outcome = outcome != null ? outcome : VisitOutcome.PENDING;
    }

    public int getAttempts() {
        return attempts;
    }

    /** Increments and returns the attempt count. */
    public int recordAttempt() {
        return ++attempts;
    }
}
