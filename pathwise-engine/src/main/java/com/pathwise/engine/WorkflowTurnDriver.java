package com.pathwise.engine;

import com.pathwise.collaborator.DomainClassifier;
import com.pathwise.collaborator.EscalationSignal;
import com.pathwise.collaborator.EscalationSink;
import com.pathwise.collaborator.PlanAccessPolicy;
import com.pathwise.engine.match.PlanMatch;
import com.pathwise.engine.match.PlanMatcher;
import com.pathwise.engine.session.WorkflowSession;
import com.pathwise.planlibrary.config.PlanLibrary;
import com.pathwise.turn.TurnHistories;
import com.pathwise.turn.TurnHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point called by the host loop once per turn, before the model call. Activates a plan when the
 * session has none, otherwise advances the active traversal, and applies the result to the session.
 * Never throws: any failure is logged and the turn proceeds without guidance.
 */
public final class WorkflowTurnDriver {

    private static final Logger log = LoggerFactory.getLogger(WorkflowTurnDriver.class);

    private final Supplier<PlanLibrary> library;
    private final DomainClassifier domainClassifier;
    private final PlanAccessPolicy accessPolicy;
    private final EscalationSink escalationSink;
    private final PlanMatcher matcher;
    private final GraphTraversalEngine engine;

    public WorkflowTurnDriver(Supplier<PlanLibrary> library, DomainClassifier domainClassifier,
                              PlanAccessPolicy accessPolicy, EscalationSink escalationSink,
                              GraphTraversalEngine engine) {
        this.library = Objects.requireNonNull(library, "library");
        this.domainClassifier = domainClassifier != null ? domainClassifier : DomainClassifier.UNKNOWN;
        this.accessPolicy = accessPolicy != null ? accessPolicy : PlanAccessPolicy.UNRESTRICTED;
        this.escalationSink = escalationSink != null ? escalationSink : EscalationSink.DISCARD;
        this.matcher = new PlanMatcher();
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public TurnResult onTurn(WorkflowSession session, TurnHistory history) {
        try {
            TurnResult result = session.hasActiveTraversal()
                    ? engine.advance(session.getTraversal().get(), library.get(), TurnHistories.lastToolOutput(history))
                    : tryActivate(history);
            apply(session, result);
            return result;
        } catch (RuntimeException e) {
            log.warn("Workflow turn failed, passing through | sessionId={}", session.getSessionId(), e);
            return TurnResult.passthrough();
        }
    }

    private TurnResult tryActivate(TurnHistory history) {
        PlanLibrary lib = library.get();
        if (lib == null || lib.isEmpty()) {
            return TurnResult.inactive();
        }
        String message = TurnHistories.lastUserMessage(history);
        if (message.isEmpty()) {
            return TurnResult.inactive();
        }
        Optional<PlanMatch> match = matcher.match(lib, domainClassifier.currentDomain(), message,
                accessPolicy.allowedPlanIds());
        if (match.isEmpty()) {
            return TurnResult.inactive();
        }
        return engine.activate(match.get().planId(), match.get().plan());
    }

    private void apply(WorkflowSession session, TurnResult result) {
        if (result.getOutcome() == TurnOutcome.ACTIVATED) {
            session.begin(result.getState().orElseThrow());
        } else if (result.getOutcome().endsTraversal()) {
            session.clearTraversal();
        }
        result.getPaceLevel().ifPresent(session::setPaceLevel);
        result.getEscalation().ifPresent(this::notifyEscalation);
    }

    private void notifyEscalation(EscalationSignal signal) {
        try {
            escalationSink.onEscalation(signal);
        } catch (RuntimeException e) {
            log.warn("Escalation sink failed | planId={} | paceLevel={}", signal.planId(), signal.paceLevel(), e);
        }
    }
}
