package com.pathwise.collaborator;

/**
 * Emitted when a traversal reaches an escalate node. Consumed by downstream severity and
 * guidance systems.
 *
 * @param planId         id of the escalated plan
 * @param planName       display name of the plan
 * @param nodeId         escalate node that was reached
 * @param paceLevel      severity tier the session moves to
 * @param reason         reason authored on the node
 * @param completedNodes task nodes completed before escalating
 * @param totalNodes     task nodes in the plan
 */
public record EscalationSignal(
        String planId,
        String planName,
        String nodeId,
        String paceLevel,
        String reason,
        int completedNodes,
        int totalNodes
) {
}
