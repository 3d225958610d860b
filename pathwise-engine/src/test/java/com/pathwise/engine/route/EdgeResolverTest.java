package com.pathwise.engine.route;

import com.pathwise.engine.TestPlans;
import com.pathwise.planlibrary.graph.EdgeCondition;
import com.pathwise.planlibrary.graph.EdgeDefinition;
import com.pathwise.planlibrary.graph.PlanGraph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EdgeResolverTest {

    private static final PlanGraph GRAPH = TestPlans.library("""
            {"plans": {"p": {"graph": {"start": "t",
              "nodes": {"t": {"type": "task"}, "a": {"type": "task"}, "b": {"type": "task"},
                        "c": {"type": "task"}, "d": {"type": "task"}},
              "edges": [{"from": "t", "to": "a"},
                        {"from": "t", "to": "b", "condition": "on_fail"},
                        {"from": "t", "to": "c", "condition": "on_success"},
                        {"from": "t", "to": "d", "condition": "on_success"}]}}}}
            """).getPlan("p").getGraph();

    private static String target(ConditionChain chain) {
        return EdgeResolver.resolve(GRAPH, "t", chain).map(EdgeDefinition::getTo).orElse(null);
    }

    @Test
    void resolve_exactConditionWinsInDocumentOrder() {
        assertEquals("c", target(ConditionChain.AFTER_SUCCESS));
    }

    @Test
    void resolve_triesFallbacksInChainOrder() {
        assertEquals("b", target(ConditionChain.AFTER_EXHAUST));
        assertEquals("a", target(ConditionChain.UNCONDITIONAL));
    }

    @Test
    void resolve_retryChainHasNoAlwaysFallback() {
        assertTrue(EdgeResolver.resolve(GRAPH, "t", ConditionChain.AFTER_RETRY).isEmpty());
    }

    @Test
    void resolve_emptyForNodeWithoutEdges() {
        assertEquals(Optional.empty(), EdgeResolver.resolve(GRAPH, "a", ConditionChain.UNCONDITIONAL));
    }

    @Test
    void forDecision_mapsOutcomeThenAlways() {
        assertEquals(List.of(EdgeCondition.ON_FAIL, EdgeCondition.ALWAYS), ConditionChain.forDecision("fail").conditions());
        assertEquals(List.of(EdgeCondition.ON_SUCCESS, EdgeCondition.ALWAYS),
                ConditionChain.forDecision("success").conditions());
        assertEquals(List.of(EdgeCondition.ALWAYS), ConditionChain.forDecision("unknown").conditions());
    }
}
