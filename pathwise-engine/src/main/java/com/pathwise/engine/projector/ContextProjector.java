package com.pathwise.engine.projector;

import com.pathwise.engine.runtime.NodeVisit;
import com.pathwise.engine.runtime.TraversalState;
import com.pathwise.planlibrary.graph.DecisionNode;
import com.pathwise.planlibrary.graph.EdgeDefinition;
import com.pathwise.planlibrary.graph.GraphNode;
import com.pathwise.planlibrary.graph.NodeType;
import com.pathwise.planlibrary.graph.PlanGraph;
import com.pathwise.planlibrary.graph.TaskNode;
import com.pathwise.planlibrary.verify.VerificationSpec;
import com.pathwise.planlibrary.verify.VerificationType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders traversal state as text for the model: a status block while a plan runs and a
 * message when it escalates. Pure; reads the state and graph only.
 */
public final class ContextProjector {

    static final String ARROW = " → ";
    static final String STATUS_FOOTER = "Execute the current step. Do not skip ahead.";
    static final String ESCALATION_FOOTER =
            "The current approach has failed. Change strategy or ask the user for guidance.";

    public String render(TraversalState state, PlanGraph graph) {
        List<String> lines = new ArrayList<>();
        lines.add("[WORKFLOW: " + state.getPlanName() + "]");

        List<String> parts = pathParts(state, graph);
        if (!parts.isEmpty()) {
            lines.add("  " + String.join(ARROW, parts));
        }

        GraphNode current = graph.getNode(state.getCurrentNode());
        if (current instanceof TaskNode task) {
            appendTaskDetail(lines, state.getCurrentNode(), task, graph);
        } else if (current instanceof DecisionNode decision) {
            String text = decision.getDescription() != null && !decision.getDescription().isBlank()
                    ? decision.getDescription()
                    : graph.displayName(state.getCurrentNode());
            lines.add("    Decision: " + text);
        }

        lines.add("");
        lines.add(STATUS_FOOTER);
        return String.join("\n", lines);
    }

    public String renderEscalation(TraversalState state, String paceLevel, String reason) {
        return "[WORKFLOW ESCALATED: " + state.getPlanName() + "]\n"
                + "  Reason: " + reason + "\n"
                + "  PACE level: " + paceLevel + "\n"
                + "  Completed: " + state.getCompletedNodes() + "/" + state.getTotalNodes() + " nodes\n"
                + "\n"
                + ESCALATION_FOOTER;
    }

    private static List<String> pathParts(TraversalState state, PlanGraph graph) {
        List<String> parts = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String currentId = state.getCurrentNode();
        for (String nodeId : state.getPath()) {
            GraphNode node = graph.getNode(nodeId);
            if (node == null || !seen.add(nodeId)) {
                continue;
            }
            if (node.getType() == NodeType.START || node.getType() == NodeType.CHECKPOINT) {
                continue;
            }
            String name = graph.displayName(nodeId);
            NodeVisit visit = state.getVisit(nodeId);
            if (nodeId.equals(currentId)) {
                parts.add(name + " << CURRENT" + attemptSuffix(node, visit));
            } else if (visit != null) {
                switch (visit.getOutcome()) {
                    case SUCCESS -> parts.add(name + " [DONE]");
                    case FAIL -> parts.add(name + " [FAILED]");
                    case PENDING -> parts.add(name + " [...]");
                }
            }
        }
        return parts;
    }

    private static String attemptSuffix(GraphNode node, NodeVisit visit) {
        if (!(node instanceof TaskNode task) || task.getMaxRetries() <= 0) {
            return "";
        }
        int attempts = visit != null ? visit.getAttempts() : 0;
        return " (attempt " + (attempts + 1) + "/" + (task.getMaxRetries() + 1) + ")";
    }

    private static void appendTaskDetail(List<String> lines, String nodeId, TaskNode task, PlanGraph graph) {
        lines.add("    Action: " + task.getAction());
        if (task.getTool() != null && !task.getTool().isBlank()) {
            lines.add("    Tool: " + task.getTool());
        }
        if (task.getToolHint() != null && !task.getToolHint().isBlank()) {
            lines.add("    Hint: " + task.getToolHint());
        }
        VerificationSpec verify = task.getVerify();
        if (verify != null && verify.getType() != VerificationType.MANUAL) {
            lines.add("    Verify: " + verify.describe());
        }
        for (EdgeDefinition edge : graph.edgesFrom(nodeId)) {
            GraphNode target = graph.getNode(edge.getTo());
            String targetName = graph.displayName(edge.getTo());
            String condition = edge.getCondition().toValue();
            if (target != null && target.getType() == NodeType.ESCALATE) {
                lines.add("    On " + condition + ARROW + "escalate: " + targetName);
            } else {
                lines.add("    On " + condition + ARROW + targetName);
            }
        }
    }
}
