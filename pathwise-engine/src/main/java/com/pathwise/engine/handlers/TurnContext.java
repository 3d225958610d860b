package com.pathwise.engine.handlers;

import com.pathwise.engine.route.AutoRouter;
import com.pathwise.engine.runtime.TraversalState;
import com.pathwise.planlibrary.graph.GraphNode;
import com.pathwise.planlibrary.graph.PlanGraph;

import java.util.Optional;

/**
 * What a node handler sees for one turn: the state to mutate, the plan graph, the current node,
 * the latest tool output and the router.
 */
public final class TurnContext {

    private final TraversalState state;
    private final PlanGraph graph;
    private final GraphNode node;
    private final Optional<String> lastToolOutput;
    private final AutoRouter router;

    public TurnContext(TraversalState state, PlanGraph graph, GraphNode node,
                       Optional<String> lastToolOutput, AutoRouter router) {
        this.state = state;
        this.graph = graph;
        this.node = node;
        this.lastToolOutput = lastToolOutput != null ? lastToolOutput : Optional.empty();
        this.router = router;
    }

    public TraversalState getState() { return state; }
    public PlanGraph getGraph() { return graph; }
    public GraphNode getNode() { return node; }
    public Optional<String> getLastToolOutput() { return lastToolOutput; }
    public AutoRouter getRouter() { return router; }
}
