package com.pathwise.engine.handlers;

import com.pathwise.planlibrary.graph.NodeType;

import java.util.Set;

/**
 * Start, decision and checkpoint nodes: never wait for output. A start node is left by its
 * unconditional edge again; decision and checkpoint nodes are auto-routed.
 */
public final class RoutingHandler implements NodeTurnHandler {

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.START, NodeType.DECISION, NodeType.CHECKPOINT);
    }

    @Override
    public void onTurn(TurnContext ctx) {
        if (ctx.getNode().getType() == NodeType.START) {
            ctx.getRouter().enterFromStart(ctx.getState(), ctx.getGraph());
        } else {
            ctx.getRouter().route(ctx.getState(), ctx.getGraph());
        }
    }
}
