package com.pathwise.collaborator;

/**
 * Receives escalation signals. Implementations must not throw; failures are logged by the caller
 * and never block the turn.
 */
@FunctionalInterface
public interface EscalationSink {

    /** Sink that drops every signal. */
    EscalationSink DISCARD = signal -> { };

    void onEscalation(EscalationSignal signal);
}
