package com.pathwise.engine.session;

import com.pathwise.engine.runtime.TraversalState;

import java.util.Optional;

/**
 * Per-session workflow value owned by the host loop: at most one active traversal, plus the
 * session pace level (raised by escalation). Not thread-safe; one session is driven by one turn at a time.
 */
public final class WorkflowSession {

    private final String sessionId;
    private TraversalState traversal;
    private String paceLevel;

    public WorkflowSession(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Optional<TraversalState> getTraversal() {
        return Optional.ofNullable(traversal);
    }

    public boolean hasActiveTraversal() {
        return traversal != null;
    }

    /** Replaces any traversal with the given one. */
    public void begin(TraversalState state) {
        this.traversal = state;
    }

    public void clearTraversal() {
        this.traversal = null;
    }

    /** Current pace level, or null when none has been set. */
    public String getPaceLevel() {
        return paceLevel;
    }

    public void setPaceLevel(String paceLevel) {
        this.paceLevel = paceLevel;
    }

    /** Progress of the active traversal, empty when none. */
    public Optional<ProgressSnapshot> snapshot() {
        return getTraversal().map(ProgressSnapshot::of);
    }
}
