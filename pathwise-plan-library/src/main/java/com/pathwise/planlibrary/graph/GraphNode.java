package com.pathwise.planlibrary.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Node in a plan graph. Concrete variants are selected by the JSON {@code type} tag; a node
 * without a tag is a {@link TaskNode}. Unknown tags fail at load time.
 * <p>
 * Nodes do not carry their id: the id is the key under which the node is stored in
 * {@link PlanGraph#getNodes()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type",
        visible = true, defaultImpl = TaskNode.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = StartNode.class, name = "start"),
        @JsonSubTypes.Type(value = TaskNode.class, name = "task"),
        @JsonSubTypes.Type(value = DecisionNode.class, name = "decision"),
        @JsonSubTypes.Type(value = CheckpointNode.class, name = "checkpoint"),
        @JsonSubTypes.Type(value = ExitNode.class, name = "exit"),
        @JsonSubTypes.Type(value = EscalateNode.class, name = "escalate")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class GraphNode {

    private final String name;

    protected GraphNode(String name) {
        this.name = name;
    }

    /** Display name (optional; renderers fall back to the node id). */
    public String getName() {
        return name;
    }

    /** Behavioral type of this node. Never null. */
    @JsonIgnore
    public abstract NodeType getType();
}
