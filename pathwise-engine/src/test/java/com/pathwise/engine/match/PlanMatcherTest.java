package com.pathwise.engine.match;

import com.pathwise.engine.TestPlans;
import com.pathwise.planlibrary.config.PlanLibrary;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanMatcherTest {

    private static final String GRAPH = """
            "graph": {"start": "s", "nodes": {"s": {"type": "start"}, "e": {"type": "exit"}},
                      "edges": [{"from": "s", "to": "e"}]}
            """;

    private static final PlanLibrary LIBRARY = TestPlans.library("""
            {"plans": {
              "tests": {"domains": ["coding"], "triggers": ["test", "fail", "fix"], %1$s},
              "anything": {"triggers": ["test", "fail", "fix"], %1$s},
              "deploy": {"domains": ["devops"], "triggers": ["deploy", "release"], %1$s},
              "eager": {"triggers": ["hello"], "trigger_threshold": 1, %1$s},
              "legacy": {"triggers": ["test", "fail", "fix", "hello"], "trigger_threshold": 1}
            }}
            """.formatted(GRAPH));

    private final PlanMatcher matcher = new PlanMatcher();

    @Test
    void match_prefersDomainTaggedPlanInItsDomain() {
        PlanMatch match = matcher.match(LIBRARY, "coding", "my tests fail", Optional.empty()).orElseThrow();

        assertEquals("tests", match.planId());
        assertEquals(2, match.hits());
        assertEquals(3.0, match.score());
    }

    @Test
    void match_skipsTaggedPlanOutsideItsDomain() {
        PlanMatch match = matcher.match(LIBRARY, "writing", "my tests fail", Optional.empty()).orElseThrow();

        assertEquals("anything", match.planId());
        assertEquals(2.0, match.score());
    }

    @Test
    void match_requiresThreshold() {
        assertTrue(matcher.match(LIBRARY, "devops", "please deploy", Optional.empty()).isEmpty());
        assertEquals("deploy",
                matcher.match(LIBRARY, "devops", "deploy the release", Optional.empty()).orElseThrow().planId());
    }

    @Test
    void match_tieKeepsFirstPlan() {
        PlanLibrary library = TestPlans.library("""
                {"plans": {
                  "first": {"triggers": ["alpha", "beta"], %1$s},
                  "second": {"triggers": ["alpha", "beta"], %1$s}
                }}
                """.formatted(GRAPH));

        assertEquals("first", matcher.match(library, "", "alpha and beta", Optional.empty()).orElseThrow().planId());
    }

    @Test
    void match_respectsAllowList() {
        PlanMatch match = matcher.match(LIBRARY, "coding", "my tests fail", Optional.of(Set.of("anything")))
                .orElseThrow();

        assertEquals("anything", match.planId());
        assertTrue(matcher.match(LIBRARY, "coding", "my tests fail", Optional.of(Set.of())).isEmpty());
    }

    @Test
    void match_neverSelectsPlanWithoutGraph() {
        PlanMatch match = matcher.match(LIBRARY, "", "hello", Optional.empty()).orElseThrow();

        assertEquals("eager", match.planId());
    }

    @Test
    void match_lowerCasesMessage() {
        assertEquals("tests", matcher.match(LIBRARY, "coding", "FIX the TEST", Optional.empty()).orElseThrow().planId());
    }

    @Test
    void match_emptyForBlankMessageOrEmptyLibrary() {
        assertTrue(matcher.match(LIBRARY, "coding", "  ", Optional.empty()).isEmpty());
        assertTrue(matcher.match(PlanLibrary.empty(), "coding", "fix the test", Optional.empty()).isEmpty());
    }
}
