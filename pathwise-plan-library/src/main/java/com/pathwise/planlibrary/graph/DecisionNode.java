package com.pathwise.planlibrary.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Routing node. Never waits for output: the engine follows {@code on_<outcome>} for the most recent
 * verification outcome, falling back to {@code always}.
 */
public final class DecisionNode extends GraphNode {

    private final String description;

    @JsonCreator
    public DecisionNode(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description) {
        super(name);
        this.description = description;
    }

    @Override
    public NodeType getType() {
        return NodeType.DECISION;
    }

    /** Human-readable routing rule shown to the agent (optional). */
    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DecisionNode that = (DecisionNode) o;
        return Objects.equals(getName(), that.getName()) && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), description);
    }
}
