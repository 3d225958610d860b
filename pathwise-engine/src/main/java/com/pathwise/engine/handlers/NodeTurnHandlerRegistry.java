package com.pathwise.engine.handlers;

import com.pathwise.planlibrary.graph.NodeType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single responsibility: map NodeType to NodeTurnHandler.
 */
public final class NodeTurnHandlerRegistry {

    private final Map<NodeType, NodeTurnHandler> handlers = new EnumMap<>(NodeType.class);
    private final NodeTurnHandler noOpHandler = new NoOpHandler();

    public NodeTurnHandlerRegistry(List<NodeTurnHandler> handlerList) {
        for (NodeTurnHandler handler : handlerList) {
            for (NodeType type : handler.supportedTypes()) {
                handlers.put(type, handler);
            }
        }
    }

    public NodeTurnHandler forType(NodeType type) {
        if (type == null) {
            return noOpHandler;
        }
        return handlers.getOrDefault(type, noOpHandler);
    }

    private static final class NoOpHandler implements NodeTurnHandler {
        @Override
        public Set<NodeType> supportedTypes() {
            return Set.of();
        }

        @Override
        public void onTurn(TurnContext ctx) {
        }
    }
}
