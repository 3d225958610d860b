package com.pathwise.planlibrary.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Behavioral type of a plan graph node. JSON uses the lower-case name as the {@code type} tag.
 *
 * @see GraphNode#getType()
 */
public enum NodeType {
    START,
    /** Actionable step: the agent runs a tool and its output is verified. */
    TASK,
    /** Routes on the outcome of the most recent verification. */
    DECISION,
    /** Transparent pass-through; reserved for future gating. */
    CHECKPOINT,
    EXIT,
    /** Policy-authored hand-off to a higher-severity process; ends the plan. */
    ESCALATE;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** True for types the engine walks through without waiting for tool output. */
    public boolean isAutoRouted() {
        return this == START || this == DECISION || this == CHECKPOINT;
    }

    /** True for types that end the traversal as soon as they are reached. */
    public boolean isTerminal() {
        return this == EXIT || this == ESCALATE;
    }
}
