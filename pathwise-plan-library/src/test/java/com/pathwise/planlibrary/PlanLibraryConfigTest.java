package com.pathwise.planlibrary;

import com.pathwise.planlibrary.config.PlanDefinition;
import com.pathwise.planlibrary.config.PlanLibrary;
import com.pathwise.planlibrary.graph.DecisionNode;
import com.pathwise.planlibrary.graph.EdgeCondition;
import com.pathwise.planlibrary.graph.EdgeDefinition;
import com.pathwise.planlibrary.graph.EscalateNode;
import com.pathwise.planlibrary.graph.NodeType;
import com.pathwise.planlibrary.graph.PlanGraph;
import com.pathwise.planlibrary.graph.TaskNode;
import com.pathwise.planlibrary.verify.VerificationType;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanLibraryConfigTest {

    private static final String LIBRARY_JSON = """
            {
              "version": "2.1",
              "plans": {
                "fix_tests": {
                  "name": "Fix Failing Tests",
                  "domains": ["coding"],
                  "triggers": ["test", "fail"],
                  "graph": {
                    "start": "start",
                    "nodes": {
                      "start": {"type": "start"},
                      "run": {"type": "task", "name": "Run tests", "action": "Run the suite", "tool": "terminal",
                              "tool_hint": "use -x", "verify": {"type": "output_not_contains", "value": "failed"},
                              "max_retries": 2},
                      "check": {"type": "decision", "description": "Are tests green?"},
                      "done": {"type": "exit"},
                      "give_up": {"type": "escalate", "pace_level": "emergency"}
                    },
                    "edges": [
                      {"from": "start", "to": "run"},
                      {"from": "run", "to": "check", "condition": "on_success"},
                      {"from": "run", "to": "give_up", "condition": "on_exhaust"},
                      {"from": "check", "to": "done", "condition": "on_success"}
                    ]
                  }
                },
                "legacy": {"name": "Old linear plan", "triggers": ["old"], "steps": [{"action": "x"}]}
              }
            }
            """;

    @Test
    void fromJson_parsesPlanLibrary() {
        PlanLibrary library = PlanLibraryConfig.fromJson(LIBRARY_JSON);

        assertEquals("2.1", library.getVersion());
        assertEquals(List.of("fix_tests", "legacy"), List.copyOf(library.getPlans().keySet()));
        PlanDefinition plan = library.getPlan("fix_tests");
        assertEquals("Fix Failing Tests", plan.getName());
        assertTrue(plan.getDomains().contains("coding"));
        assertEquals(PlanDefinition.DEFAULT_TRIGGER_THRESHOLD, plan.getTriggerThreshold());
        assertEquals(PlanDefinition.DEFAULT_STALE_AFTER_TURNS, plan.getStaleAfterTurns());
        assertTrue(plan.hasGraph());
    }

    @Test
    void fromJson_parsesEnumValuesUnderTurkishDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            PlanGraph graph = PlanLibraryConfig.fromJson("""
                    {"plans": {"deploy": {"triggers": ["deploy"], "graph": {"start": "start",
                      "nodes": {"start": {"type": "start"},
                                "write": {"type": "task", "action": "Write manifest",
                                          "verify": {"type": "file_exists", "value": "deploy.yaml"}},
                                "check": {"type": "decision"},
                                "stop": {"type": "exit"}},
                      "edges": [{"from": "start", "to": "write"},
                                {"from": "write", "to": "check", "condition": "on_success"},
                                {"from": "check", "to": "stop", "condition": "on_fail"},
                                {"from": "check", "to": "stop"}]}}}}
                    """).getPlan("deploy").getGraph();

            assertEquals(VerificationType.FILE_EXISTS, ((TaskNode) graph.getNode("write")).getVerify().getType());
            assertEquals(EdgeCondition.ON_FAIL, graph.edgesFrom("check").get(0).getCondition());
            assertEquals("on_fail", EdgeCondition.ON_FAIL.toValue());
            assertEquals("decision", NodeType.DECISION.toValue());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void fromJson_resolvesNodeVariantsByTypeTag() {
        PlanGraph graph = PlanLibraryConfig.fromJson(LIBRARY_JSON).getPlan("fix_tests").getGraph();

        assertEquals(NodeType.START, graph.getNode("start").getType());
        TaskNode run = (TaskNode) graph.getNode("run");
        assertEquals("Run the suite", run.getAction());
        assertEquals("terminal", run.getTool());
        assertEquals("use -x", run.getToolHint());
        assertEquals(VerificationType.OUTPUT_NOT_CONTAINS, run.getVerify().getType());
        assertEquals("failed", run.getVerify().getValue());
        assertEquals(2, run.getMaxRetries());
        assertEquals("Are tests green?", ((DecisionNode) graph.getNode("check")).getDescription());
        assertEquals(NodeType.EXIT, graph.getNode("done").getType());
        EscalateNode giveUp = (EscalateNode) graph.getNode("give_up");
        assertEquals("emergency", giveUp.getPaceLevel());
        assertEquals(EscalateNode.DEFAULT_REASON, giveUp.getReason());
        assertEquals(1, graph.getTaskNodeCount());
    }

    @Test
    void fromJson_defaultsMissingConditionToAlways() {
        PlanGraph graph = PlanLibraryConfig.fromJson(LIBRARY_JSON).getPlan("fix_tests").getGraph();

        List<EdgeDefinition> fromStart = graph.edgesFrom("start");
        assertEquals(1, fromStart.size());
        assertEquals(EdgeCondition.ALWAYS, fromStart.get(0).getCondition());
        assertEquals(List.of("check", "give_up"), graph.edgesFrom("run").stream().map(EdgeDefinition::getTo).toList());
    }

    @Test
    void fromJson_keepsPlansWithoutGraph() {
        PlanDefinition legacy = PlanLibraryConfig.fromJson(LIBRARY_JSON).getPlan("legacy");

        assertNotNull(legacy);
        assertFalse(legacy.hasGraph());
        assertNull(legacy.getGraph());
    }

    @Test
    void fromJson_untaggedNodeIsTask() {
        String json = """
                {"plans": {"p": {"triggers": ["a"], "graph": {"start": "s",
                  "nodes": {"s": {"type": "start"}, "t": {"action": "do it"}},
                  "edges": [{"from": "s", "to": "t"}]}}}}
                """;

        TaskNode task = (TaskNode) PlanLibraryConfig.fromJson(json).getPlan("p").getGraph().getNode("t");

        assertEquals("do it", task.getAction());
        assertEquals(0, task.getMaxRetries());
        assertNull(task.getVerify());
    }

    @Test
    void fromJson_rejectsUnknownNodeType() {
        String json = """
                {"plans": {"p": {"graph": {"start": "s",
                  "nodes": {"s": {"type": "start"}, "x": {"type": "teleport"}}, "edges": []}}}}
                """;

        assertThrows(UncheckedIOException.class, () -> PlanLibraryConfig.fromJson(json));
    }

    @Test
    void fromJson_rejectsUnknownEdgeCondition() {
        String json = """
                {"plans": {"p": {"graph": {"start": "s", "nodes": {"s": {"type": "start"}, "e": {"type": "exit"}},
                  "edges": [{"from": "s", "to": "e", "condition": "on_maybe"}]}}}}
                """;

        assertThrows(UncheckedIOException.class, () -> PlanLibraryConfig.fromJson(json));
    }

    @Test
    void fromJson_rejectsUnknownVerificationType() {
        String json = """
                {"plans": {"p": {"graph": {"start": "t",
                  "nodes": {"t": {"type": "task", "verify": {"type": "smells_right"}}}, "edges": []}}}}
                """;

        assertThrows(UncheckedIOException.class, () -> PlanLibraryConfig.fromJson(json));
    }

    @Test
    void toJson_writesSnakeCaseAndReadsBack() {
        PlanLibrary library = PlanLibraryConfig.fromJson(LIBRARY_JSON);

        String json = PlanLibraryConfig.toJson(library);

        assertTrue(json.contains("\"max_retries\""));
        assertTrue(json.contains("\"on_exhaust\""));
        assertTrue(json.contains("\"type\" : \"decision\""));
        assertEquals(library, PlanLibraryConfig.fromJson(json));
    }
}
