package com.pathwise.planlibrary.load;

import com.pathwise.planlibrary.config.PlanDefinition;
import com.pathwise.planlibrary.config.PlanLibrary;
import com.pathwise.planlibrary.graph.EdgeCondition;
import com.pathwise.planlibrary.graph.EdgeDefinition;
import com.pathwise.planlibrary.graph.GraphNode;
import com.pathwise.planlibrary.graph.NodeType;
import com.pathwise.planlibrary.graph.PlanGraph;
import com.pathwise.planlibrary.graph.TaskNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Load-time structural checks for graph plans. Plans without a graph are not checked
 * (they are never activated).
 */
public final class PlanLibraryValidator {

    private PlanLibraryValidator() {
    }

    /** Returns every problem found; empty when the library is valid. */
    public static List<String> findProblems(PlanLibrary library) {
        List<String> problems = new ArrayList<>();
        if (library == null) {
            problems.add("library is null");
            return problems;
        }
        for (Map.Entry<String, PlanDefinition> e : library.getPlans().entrySet()) {
            String planId = e.getKey();
            PlanDefinition plan = e.getValue();
            if (plan == null) {
                problems.add(planId + ": plan is null");
                continue;
            }
            if (plan.getTriggerThreshold() < 1) {
                problems.add(planId + ": trigger_threshold must be >= 1, got " + plan.getTriggerThreshold());
            }
            if (plan.getStaleAfterTurns() < 1) {
                problems.add(planId + ": stale_after_turns must be >= 1, got " + plan.getStaleAfterTurns());
            }
            if (plan.hasGraph()) {
                checkGraph(planId, plan.getGraph(), problems);
            }
        }
        return problems;
    }

    /**
     * Throws when {@link #findProblems} reports anything.
     *
     * @throws PlanLibraryValidationException listing all problems
     */
    public static PlanLibrary validate(PlanLibrary library) {
        List<String> problems = findProblems(library);
        if (!problems.isEmpty()) {
            throw new PlanLibraryValidationException(problems);
        }
        return library;
    }

    private static void checkGraph(String planId, PlanGraph graph, List<String> problems) {
        String start = graph.getStart();
        if (start == null || start.isBlank()) {
            problems.add(planId + ": graph has no start node");
        } else {
            GraphNode startNode = graph.getNode(start);
            if (startNode == null) {
                problems.add(planId + ": start node '" + start + "' is not defined");
            } else if (startNode.getType() == NodeType.START && graph.edgesFrom(start).stream()
                    .noneMatch(edge -> edge.getCondition() == EdgeCondition.ALWAYS)) {
                problems.add(planId + ": start node '" + start + "' has no 'always' edge");
            }
        }
        for (Map.Entry<String, GraphNode> n : graph.getNodes().entrySet()) {
            if (n.getValue() == null) {
                problems.add(planId + ": node '" + n.getKey() + "' is null");
            } else if (n.getValue() instanceof TaskNode && ((TaskNode) n.getValue()).getMaxRetries() < 0) {
                problems.add(planId + ": node '" + n.getKey() + "' has negative max_retries");
            }
        }
        for (EdgeDefinition edge : graph.getEdges()) {
            if (graph.getNode(edge.getFrom()) == null) {
                problems.add(planId + ": edge " + edge + " starts at undefined node '" + edge.getFrom() + "'");
            }
            if (graph.getNode(edge.getTo()) == null) {
                problems.add(planId + ": edge " + edge + " targets undefined node '" + edge.getTo() + "'");
            }
        }
    }
}
