package com.pathwise.engine.handlers;

import com.pathwise.engine.event.TraversalEventType;
import com.pathwise.engine.route.ConditionChain;
import com.pathwise.engine.runtime.NodeVisit;
import com.pathwise.engine.runtime.TraversalState;
import com.pathwise.engine.runtime.VisitOutcome;
import com.pathwise.engine.verify.VerificationEvaluator;
import com.pathwise.planlibrary.graph.NodeType;
import com.pathwise.planlibrary.graph.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Task nodes: verify the latest tool output, then follow the success, retry or exhaust edges.
 * Does nothing on a turn without tool output.
 */
public final class TaskHandler implements NodeTurnHandler {

    private static final Logger log = LoggerFactory.getLogger(TaskHandler.class);

    private final VerificationEvaluator evaluator;

    public TaskHandler(VerificationEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public Set<NodeType> supportedTypes() {
        return Set.of(NodeType.TASK);
    }

    @Override
    public void onTurn(TurnContext ctx) {
        if (ctx.getLastToolOutput().isEmpty()) {
            return;
        }
        TraversalState state = ctx.getState();
        TaskNode task = (TaskNode) ctx.getNode();
        String nodeId = state.getCurrentNode();

        NodeVisit visit = state.visitFor(nodeId);
        int attempts = visit.recordAttempt();
        boolean verified = evaluator.verify(task.getVerify(), ctx.getLastToolOutput().get());
        state.record(TraversalEventType.NODE_VERIFIED, nodeId,
                Map.of("outcome", verified ? VisitOutcome.SUCCESS.toValue() : VisitOutcome.FAIL.toValue()));

        if (verified) {
            visit.setOutcome(VisitOutcome.SUCCESS);
            if (state.recordCompletion(nodeId)) {
                log.info("Step verified | planId={} | nodeId={} | completed={}/{}",
                        state.getPlanId(), nodeId, state.getCompletedNodes(), state.getTotalNodes());
            }
            if (!ctx.getRouter().followAndRoute(state, ctx.getGraph(), ConditionChain.AFTER_SUCCESS)) {
                log.warn("Stalled: no edge on success | planId={} | nodeId={}", state.getPlanId(), nodeId);
            }
        } else if (attempts <= task.getMaxRetries()) {
            state.record(TraversalEventType.RETRY_TRIGGERED, nodeId, Map.of());
            if (!ctx.getRouter().followAndRoute(state, ctx.getGraph(), ConditionChain.AFTER_RETRY)) {
                log.debug("Retry in place | planId={} | nodeId={} | attempt={}/{}",
                        state.getPlanId(), nodeId, attempts, task.getMaxRetries() + 1);
            }
        } else {
            visit.setOutcome(VisitOutcome.FAIL);
            state.recordFailure(nodeId);
            if (!ctx.getRouter().followAndRoute(state, ctx.getGraph(), ConditionChain.AFTER_EXHAUST)) {
                log.warn("Stalled: no edge on exhaust | planId={} | nodeId={}", state.getPlanId(), nodeId);
            }
        }
    }
}
