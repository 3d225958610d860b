package com.pathwise.planlibrary.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Directed workflow graph of a plan: nodes keyed by id, conditioned edges, and the start node id.
 * Node insertion order is preserved. Edges keep their document order, which is the order used when
 * several edges from the same node share a condition.
 */
public final class PlanGraph {

    private final String start;
    private final Map<String, GraphNode> nodes;
    private final List<EdgeDefinition> edges;

    @JsonCreator
    public PlanGraph(
            @JsonProperty("start") String start,
            @JsonProperty("nodes") Map<String, GraphNode> nodes,
            @JsonProperty("edges") List<EdgeDefinition> edges) {
        this.start = start;
        this.nodes = nodes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(nodes)) : Map.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public String getStart() {
        return start;
    }

    public Map<String, GraphNode> getNodes() {
        return nodes;
    }

    public List<EdgeDefinition> getEdges() {
        return edges;
    }

    /** Returns the node with the given id, or null if the graph has none. */
    public GraphNode getNode(String nodeId) {
        return nodeId != null ? nodes.get(nodeId) : null;
    }

    /** Outgoing edges of a node, in document order. */
    public List<EdgeDefinition> edgesFrom(String nodeId) {
        if (nodeId == null) return List.of();
        return edges.stream().filter(e -> nodeId.equals(e.getFrom())).toList();
    }

    /** Display name of a node; falls back to the id when the node is unknown or unnamed. */
    public String displayName(String nodeId) {
        GraphNode node = getNode(nodeId);
        if (node == null || node.getName() == null || node.getName().isBlank()) return nodeId;
        return node.getName();
    }

    /** Number of task nodes; the denominator of plan progress. */
    @JsonIgnore
    public int getTaskNodeCount() {
        return (int) nodes.values().stream().filter(n -> n.getType() == NodeType.TASK).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlanGraph that = (PlanGraph) o;
        return Objects.equals(start, that.start) && Objects.equals(nodes, that.nodes) && Objects.equals(edges, that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, nodes, edges);
    }
}
