package com.pathwise.planlibrary.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Entry point of a plan graph. Followed on its {@code always} edge at activation. */
public final class StartNode extends GraphNode {

    @JsonCreator
    public StartNode(@JsonProperty("name") String name) {
        super(name);
    }

    @Override
    public NodeType getType() {
        return NodeType.START;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(getName(), ((StartNode) o).getName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getType(), getName());
    }
}
