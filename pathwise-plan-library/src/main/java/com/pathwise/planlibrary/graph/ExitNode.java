package com.pathwise.planlibrary.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Successful end of a plan. */
public final class ExitNode extends GraphNode {

    @JsonCreator
    public ExitNode(@JsonProperty("name") String name) {
        super(name);
    }

    @Override
    public NodeType getType() {
        return NodeType.EXIT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(getName(), ((ExitNode) o).getName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getType(), getName());
    }
}
