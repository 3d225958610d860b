package com.pathwise.planlibrary.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pathwise.planlibrary.graph.PlanGraph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One plan of the library: selection data (domains, triggers, threshold), the workflow graph
 * and the staleness window. Immutable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PlanDefinition {

    public static final int DEFAULT_TRIGGER_THRESHOLD = 2;
    public static final int DEFAULT_STALE_AFTER_TURNS = 15;

    private final String name;
    private final Set<String> domains;
    private final List<String> triggers;
    private final int triggerThreshold;
    private final int staleAfterTurns;
    private final PlanGraph graph;

    @JsonCreator
    public PlanDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("domains") List<String> domains,
            @JsonProperty("triggers") List<String> triggers,
            @JsonProperty("trigger_threshold") Integer triggerThreshold,
            @JsonProperty("stale_after_turns") Integer staleAfterTurns,
            @JsonProperty("graph") PlanGraph graph) {
        this.name = name;
        this.domains = domains != null ? Collections.unmodifiableSet(new LinkedHashSet<>(domains)) : Set.of();
        this.triggers = triggers != null ? List.copyOf(triggers) : List.of();
        this.triggerThreshold = triggerThreshold != null ? triggerThreshold : DEFAULT_TRIGGER_THRESHOLD;
        this.staleAfterTurns = staleAfterTurns != null ? staleAfterTurns : DEFAULT_STALE_AFTER_TURNS;
        this.graph = graph;
    }

    /** Display name (optional; callers fall back to the plan id). */
    public String getName() {
        return name;
    }

    /** Domain tags the plan applies to; empty means every domain. */
    public Set<String> getDomains() {
        return domains;
    }

    /** Lower-case keywords matched as substrings of the user message. */
    public List<String> getTriggers() {
        return triggers;
    }

    @JsonProperty("trigger_threshold")
    public int getTriggerThreshold() {
        return triggerThreshold;
    }

    /** Turns without a transition after which an active traversal expires. */
    @JsonProperty("stale_after_turns")
    public int getStaleAfterTurns() {
        return staleAfterTurns;
    }

    /** Workflow graph, or null for legacy linear plans (not executable by the graph engine). */
    public PlanGraph getGraph() {
        return graph;
    }

    @JsonIgnore
    public boolean hasGraph() {
        return graph != null;
    }

    /** Name to show for this plan: {@link #getName()} or the given id when unnamed. */
    public String displayName(String planId) {
        return name != null && !name.isBlank() ? name : planId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlanDefinition that = (PlanDefinition) o;
        return triggerThreshold == that.triggerThreshold
                && staleAfterTurns == that.staleAfterTurns
                && Objects.equals(name, that.name)
                && Objects.equals(domains, that.domains)
                && Objects.equals(triggers, that.triggers)
                && Objects.equals(graph, that.graph);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, domains, triggers, triggerThreshold, staleAfterTurns, graph);
    }
}
