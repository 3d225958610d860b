package com.pathwise.engine.session;

import com.pathwise.engine.runtime.TraversalState;

import java.util.List;

/**
 * Read-only progress view for the supervisor that watches for stuck or cycling sessions.
 * A rising {@code turnsSinceProgress} with a low {@code turnsSinceTransition} indicates cycling.
 */
public record ProgressSnapshot(
        String planId,
        String planName,
        String currentNode,
        int turnsSinceProgress,
        int turnsSinceTransition,
        int completedNodes,
        int totalNodes,
        List<String> stepsCompleted,
        List<String> stepsFailed
) {

    public ProgressSnapshot {
        stepsCompleted = List.copyOf(stepsCompleted);
        stepsFailed = List.copyOf(stepsFailed);
    }

    public static ProgressSnapshot of(TraversalState state) {
        return new ProgressSnapshot(
                state.getPlanId(),
                state.getPlanName(),
                state.getCurrentNode(),
                state.getTurnsSinceProgress(),
                state.getTurnsSinceTransition(),
                state.getCompletedNodes(),
                state.getTotalNodes(),
                List.copyOf(state.getStepsCompleted()),
                List.copyOf(state.getStepsFailed()));
    }
}
