package com.pathwise.planlibrary.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Pass-through node, followed on its {@code always} edge. */
public final class CheckpointNode extends GraphNode {

    @JsonCreator
    public CheckpointNode(@JsonProperty("name") String name) {
        super(name);
    }

    @Override
    public NodeType getType() {
        return NodeType.CHECKPOINT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(getName(), ((CheckpointNode) o).getName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getType(), getName());
    }
}
