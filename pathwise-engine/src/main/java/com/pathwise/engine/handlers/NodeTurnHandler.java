package com.pathwise.engine.handlers;

import com.pathwise.planlibrary.graph.NodeType;

import java.util.Set;

/**
 * Single responsibility: advance the traversal for one turn while it sits on a node of the supported types.
 */
public interface NodeTurnHandler {

    Set<NodeType> supportedTypes();

    /** Mutates the state in the context; may move the traversal along edges. */
    void onTurn(TurnContext ctx);
}
