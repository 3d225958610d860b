package com.pathwise.engine.route;

import com.pathwise.planlibrary.graph.EdgeCondition;
import com.pathwise.planlibrary.graph.EdgeDefinition;
import com.pathwise.planlibrary.graph.PlanGraph;

import java.util.List;
import java.util.Optional;

/**
 * Finds the outgoing edge to follow for a condition chain.
 */
public final class EdgeResolver {

    private EdgeResolver() {
    }

    public static Optional<EdgeDefinition> resolve(PlanGraph graph, String fromNode, ConditionChain chain) {
        List<EdgeDefinition> outgoing = graph.edgesFrom(fromNode);
        for (EdgeCondition condition : chain.conditions()) {
            for (EdgeDefinition edge : outgoing) {
                if (edge.getCondition() == condition) {
                    return Optional.of(edge);
                }
            }
        }
        return Optional.empty();
    }
}
