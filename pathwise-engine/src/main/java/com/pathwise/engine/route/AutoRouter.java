package com.pathwise.engine.route;

import com.pathwise.engine.runtime.TraversalState;
import com.pathwise.planlibrary.graph.EdgeDefinition;
import com.pathwise.planlibrary.graph.GraphNode;
import com.pathwise.planlibrary.graph.PlanGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Moves a traversal along edges and auto-routes through start, decision and checkpoint nodes until
 * it reaches a task or terminal node, a node with no usable edge, or the depth ceiling.
 */
public final class AutoRouter {

    private static final Logger log = LoggerFactory.getLogger(AutoRouter.class);

    private final int maxDepth;

    public AutoRouter(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Follows the first edge from the current node that satisfies the chain.
     *
     * @return true if the traversal moved
     */
    public boolean follow(TraversalState state, PlanGraph graph, ConditionChain chain) {
        String from = state.getCurrentNode();
        Optional<EdgeDefinition> edge = EdgeResolver.resolve(graph, from, chain);
        if (edge.isEmpty()) {
            log.debug("No edge | planId={} | from={} | chain={}", state.getPlanId(), from, chain.conditions());
            return false;
        }
        EdgeDefinition e = edge.get();
        log.debug("Edge followed | planId={} | edge={}", state.getPlanId(), e);
        state.moveTo(from, e.getTo(), e.getCondition());
        return true;
    }

    /** Follows an edge with the chain, then auto-routes from wherever it lands. */
    public boolean followAndRoute(TraversalState state, PlanGraph graph, ConditionChain chain) {
        if (!follow(state, graph, chain)) {
            return false;
        }
        route(state, graph);
        return true;
    }

    /**
     * Leaves the start node by its unconditional edge and auto-routes. Used on activation and when a
     * traversal is found sitting on its start node.
     */
    public void enterFromStart(TraversalState state, PlanGraph graph) {
        followAndRoute(state, graph, ConditionChain.UNCONDITIONAL);
    }

    /**
     * Auto-routes from the current node; at most {@code maxDepth} edges per call. A run that ends
     * at the ceiling on an auto-routed node does not count as a transition, so a plan cycling
     * between routing nodes still expires.
     */
    public void route(TraversalState state, PlanGraph graph) {
        int turnsSinceTransition = state.getTurnsSinceTransition();
        for (int depth = 0; depth < maxDepth; depth++) {
            GraphNode node = graph.getNode(state.getCurrentNode());
            if (node == null) {
                return;
            }
            ConditionChain chain = switch (node.getType()) {
                case DECISION -> ConditionChain.forDecision(state.getEvents().lastOutcome());
                case START, CHECKPOINT -> ConditionChain.UNCONDITIONAL;
                case TASK, EXIT, ESCALATE -> null;
            };
            if (chain == null || !follow(state, graph, chain)) {
                return;
            }
        }
        GraphNode last = graph.getNode(state.getCurrentNode());
        if (last != null && last.getType().isAutoRouted()) {
            log.warn("Auto-routing depth reached | planId={} | node={} | maxDepth={}",
                    state.getPlanId(), state.getCurrentNode(), maxDepth);
            state.restoreTurnsSinceTransition(turnsSinceTransition);
        }
    }
}
