package com.pathwise.engine.route;

import com.pathwise.planlibrary.graph.EdgeCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered edge conditions to try when leaving a node. The first condition with a matching
 * outgoing edge wins; within one condition, edges are tried in document order.
 *
 * @param conditions conditions in priority order
 */
public record ConditionChain(List<EdgeCondition> conditions) {

    /** Leaving a start or checkpoint node. */
    public static final ConditionChain UNCONDITIONAL = of(EdgeCondition.ALWAYS);
    /** After a task verified. */
    public static final ConditionChain AFTER_SUCCESS = of(EdgeCondition.ON_SUCCESS, EdgeCondition.ALWAYS);
    /** After a failed attempt with retries left. No fallback: without an on_retry edge the task stays put. */
    public static final ConditionChain AFTER_RETRY = of(EdgeCondition.ON_RETRY);
    /** After retries ran out. */
    public static final ConditionChain AFTER_EXHAUST =
            of(EdgeCondition.ON_EXHAUST, EdgeCondition.ON_FAIL, EdgeCondition.ALWAYS);

    public ConditionChain {
        conditions = List.copyOf(conditions);
    }

    public static ConditionChain of(EdgeCondition... conditions) {
        return new ConditionChain(List.of(conditions));
    }

    /** Leaving a decision node: the condition for the last verification outcome, then always. */
    public static ConditionChain forDecision(String lastOutcome) {
        List<EdgeCondition> list = new ArrayList<>(2);
        EdgeCondition.forOutcome(lastOutcome).ifPresent(list::add);
        if (!list.contains(EdgeCondition.ALWAYS)) {
            list.add(EdgeCondition.ALWAYS);
        }
        return new ConditionChain(list);
    }
}
