package com.pathwise.engine;

import com.pathwise.collaborator.EscalationSignal;
import com.pathwise.engine.runtime.TraversalState;

import java.util.Optional;

/**
 * Result of one turn: outcome, the traversal state it concerns, and the text to inject into the
 * model's context (status block or escalation message).
 */
public final class TurnResult {

    private static final TurnResult INACTIVE = new TurnResult(TurnOutcome.INACTIVE, null, null, null, null);
    private static final TurnResult PASSTHROUGH = new TurnResult(TurnOutcome.PASSTHROUGH, null, null, null, null);

    private final TurnOutcome outcome;
    private final TraversalState state;
    private final String injection;
    private final String paceLevel;
    private final EscalationSignal escalation;

    private TurnResult(TurnOutcome outcome, TraversalState state, String injection,
                       String paceLevel, EscalationSignal escalation) {
        this.outcome = outcome;
        this.state = state;
        this.injection = injection;
        this.paceLevel = paceLevel;
        this.escalation = escalation;
    }

    public static TurnResult inactive() {
        return INACTIVE;
    }

    public static TurnResult passthrough() {
        return PASSTHROUGH;
    }

    /** Running traversal ({@link TurnOutcome#ACTIVATED} or {@link TurnOutcome#ADVANCED}) with its status block. */
    public static TurnResult running(TurnOutcome outcome, TraversalState state, String statusBlock) {
        return new TurnResult(outcome, state, statusBlock, null, null);
    }

    public static TurnResult completed(TraversalState state) {
        return new TurnResult(TurnOutcome.COMPLETED, state, null, null, null);
    }

    public static TurnResult expired(TraversalState state) {
        return new TurnResult(TurnOutcome.EXPIRED, state, null, null, null);
    }

    public static TurnResult abandoned(TraversalState state) {
        return new TurnResult(TurnOutcome.ABANDONED, state, null, null, null);
    }

    public static TurnResult escalated(TraversalState state, String message, EscalationSignal signal) {
        return new TurnResult(TurnOutcome.ESCALATED, state, message, signal.paceLevel(), signal);
    }

    public TurnOutcome getOutcome() {
        return outcome;
    }

    public Optional<TraversalState> getState() {
        return Optional.ofNullable(state);
    }

    public Optional<String> getInjection() {
        return Optional.ofNullable(injection);
    }

    /** New session pace level; present only on escalation. */
    public Optional<String> getPaceLevel() {
        return Optional.ofNullable(paceLevel);
    }

    public Optional<EscalationSignal> getEscalation() {
        return Optional.ofNullable(escalation);
    }

    @Override
    public String toString() {
        return "TurnResult{outcome=" + outcome
                + (state != null ? ", planId=" + state.getPlanId() + ", node=" + state.getCurrentNode() : "")
                + (paceLevel != null ? ", paceLevel=" + paceLevel : "")
                + '}';
    }
}
