package com.pathwise.engine;

import com.pathwise.collaborator.EscalationSignal;
import com.pathwise.config.PathwiseConfig;
import com.pathwise.engine.event.TraversalEventType;
import com.pathwise.engine.handlers.NodeTurnHandlerRegistry;
import com.pathwise.engine.handlers.RoutingHandler;
import com.pathwise.engine.handlers.TaskHandler;
import com.pathwise.engine.handlers.TurnContext;
import com.pathwise.engine.projector.ContextProjector;
import com.pathwise.engine.route.AutoRouter;
import com.pathwise.engine.runtime.TraversalState;
import com.pathwise.engine.runtime.TraversalStatus;
import com.pathwise.engine.verify.VerificationEvaluator;
import com.pathwise.planlibrary.config.PlanDefinition;
import com.pathwise.planlibrary.config.PlanLibrary;
import com.pathwise.planlibrary.graph.EscalateNode;
import com.pathwise.planlibrary.graph.GraphNode;
import com.pathwise.planlibrary.graph.PlanGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Graph traversal state machine. Activates plans and advances a traversal once per turn, mutating
 * the passed {@link TraversalState}. Holds no per-session state itself.
 * <p>
 * Each advance: bump turn counters, expire if stale, resolve plan and current node (abandon if
 * either is gone), let the node's handler act, then settle on the landing node: exit completes,
 * escalate escalates, anything else yields a status block.
 */
public final class GraphTraversalEngine {

    private static final Logger log = LoggerFactory.getLogger(GraphTraversalEngine.class);

    private final EngineLimits limits;
    private final String defaultPaceLevel;
    private final AutoRouter router;
    private final NodeTurnHandlerRegistry handlers;
    private final ContextProjector projector;

    public GraphTraversalEngine() {
        this(EngineLimits.DEFAULT, PathwiseConfig.DEFAULT_PACE_LEVEL);
    }

    public GraphTraversalEngine(EngineLimits limits, String defaultPaceLevel) {
        this(limits, defaultPaceLevel, new VerificationEvaluator(), new ContextProjector());
    }

    public GraphTraversalEngine(EngineLimits limits, String defaultPaceLevel,
                                VerificationEvaluator evaluator, ContextProjector projector) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.defaultPaceLevel = defaultPaceLevel != null && !defaultPaceLevel.isBlank()
                ? defaultPaceLevel : PathwiseConfig.DEFAULT_PACE_LEVEL;
        this.router = new AutoRouter(limits.getMaxRouteDepth());
        this.handlers = new NodeTurnHandlerRegistry(List.of(new TaskHandler(evaluator), new RoutingHandler()));
        this.projector = Objects.requireNonNull(projector, "projector");
    }

    /**
     * Starts a traversal of the plan: enters the start node, leaves it by its unconditional edge and
     * auto-routes to the first task (or terminal) node.
     *
     * @throws IllegalArgumentException when the plan has no graph
     */
    public TurnResult activate(String planId, PlanDefinition plan) {
        if (plan == null || !plan.hasGraph()) {
            throw new IllegalArgumentException("Plan has no graph: " + planId);
        }
        PlanGraph graph = plan.getGraph();
        TraversalState state = new TraversalState(planId, plan.displayName(planId), graph.getStart(),
                graph.getTaskNodeCount(), plan.getStaleAfterTurns(), limits.getEventLogCapacity());
        state.record(TraversalEventType.PLAN_ACTIVATED, graph.getStart(), Map.of("plan", planId));
        state.record(TraversalEventType.NODE_ENTERED, graph.getStart(), Map.of());
        router.enterFromStart(state, graph);
        log.info("Plan activated | planId={} | planName={} | node={}",
                planId, state.getPlanName(), state.getCurrentNode());
        return settle(state, graph, TurnOutcome.ACTIVATED);
    }

    /**
     * Advances an active traversal by one turn.
     *
     * @param state          traversal to mutate
     * @param library        library the traversal's plan is resolved from
     * @param lastToolOutput most recent tool output, empty when none has been produced yet
     */
    public TurnResult advance(TraversalState state, PlanLibrary library, Optional<String> lastToolOutput) {
        state.beginTurn();
        if (state.isStale()) {
            state.record(TraversalEventType.PLAN_EXPIRED, state.getCurrentNode(), Map.of());
            state.setStatus(TraversalStatus.EXPIRED);
            log.info("Plan expired | planId={} | node={} | staleAfterTurns={}",
                    state.getPlanId(), state.getCurrentNode(), state.getStaleAfterTurns());
            return TurnResult.expired(state);
        }

        PlanDefinition plan = library != null ? library.getPlan(state.getPlanId()) : null;
        if (plan == null || !plan.hasGraph()) {
            log.warn("Plan abandoned: plan not found | planId={}", state.getPlanId());
            return TurnResult.abandoned(state);
        }
        PlanGraph graph = plan.getGraph();
        GraphNode node = graph.getNode(state.getCurrentNode());
        if (node == null) {
            log.warn("Plan abandoned: node not found | planId={} | node={}", state.getPlanId(), state.getCurrentNode());
            return TurnResult.abandoned(state);
        }

        handlers.forType(node.getType()).onTurn(new TurnContext(state, graph, node, lastToolOutput, router));
        return settle(state, graph, TurnOutcome.ADVANCED);
    }

    private TurnResult settle(TraversalState state, PlanGraph graph, TurnOutcome running) {
        GraphNode node = graph.getNode(state.getCurrentNode());
        if (node == null) {
            log.warn("Plan abandoned: node not found | planId={} | node={}", state.getPlanId(), state.getCurrentNode());
            return TurnResult.abandoned(state);
        }
        return switch (node.getType()) {
            case EXIT -> complete(state);
            case ESCALATE -> escalate(state, (EscalateNode) node);
            case TASK -> running(state, graph, running, TraversalStatus.AWAITING_OUTPUT);
            default -> running(state, graph, running, TraversalStatus.ROUTING);
        };
    }

    private TurnResult running(TraversalState state, PlanGraph graph, TurnOutcome outcome, TraversalStatus status) {
        state.setStatus(status);
        return TurnResult.running(outcome, state, projector.render(state, graph));
    }

    private TurnResult complete(TraversalState state) {
        state.record(TraversalEventType.PLAN_COMPLETED, state.getCurrentNode(), Map.of());
        state.setStatus(TraversalStatus.COMPLETED);
        log.info("Plan completed | planId={} | completed={}/{}",
                state.getPlanId(), state.getCompletedNodes(), state.getTotalNodes());
        return TurnResult.completed(state);
    }

    private TurnResult escalate(TraversalState state, EscalateNode node) {
        String paceLevel = node.getPaceLevel() != null ? node.getPaceLevel() : defaultPaceLevel;
        String reason = node.getReason();
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("reason", reason);
        attributes.put("pace_level", paceLevel);
        state.record(TraversalEventType.PLAN_ESCALATED, state.getCurrentNode(), attributes);
        state.setStatus(TraversalStatus.ESCALATED);
        log.warn("Plan escalated | planId={} | node={} | paceLevel={} | reason={}",
                state.getPlanId(), state.getCurrentNode(), paceLevel, reason);
        EscalationSignal signal = new EscalationSignal(state.getPlanId(), state.getPlanName(),
                state.getCurrentNode(), paceLevel, reason, state.getCompletedNodes(), state.getTotalNodes());
        return TurnResult.escalated(state, projector.renderEscalation(state, paceLevel, reason), signal);
    }
}
