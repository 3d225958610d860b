package com.pathwise.engine.runtime;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.pathwise.engine.event.TraversalEventLog;
import com.pathwise.engine.event.TraversalEventType;
import com.pathwise.planlibrary.graph.EdgeCondition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable per-session traversal state. Owned by one session and mutated only by the engine
 * while it processes a turn.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE)
public final class TraversalState {

    private String planId;
    private String planName;
    private int staleAfterTurns;
    private String currentNode;
    private List<String> path;
    private LinkedHashMap<String, NodeVisit> visits;
    private int turnsSinceTransition;
    private int turnsSinceProgress;
    private int turnsElapsed;
    private int completedNodes;
    private int totalNodes;
    private LinkedHashSet<String> stepsCompleted;
    private LinkedHashSet<String> stepsFailed;
    private TraversalEventLog events;
    private TraversalStatus status;

    public TraversalState(String planId, String planName, String startNode,
                          int totalNodes, int staleAfterTurns, int eventLogCapacity) {
        this.planId = planId;
        this.planName = planName;
        this.staleAfterTurns = staleAfterTurns;
        this.currentNode = startNode;
        this.path = new ArrayList<>(List.of(startNode));
        this.visits = new LinkedHashMap<>();
        this.totalNodes = totalNodes;
        this.stepsCompleted = new LinkedHashSet<>();
        this.stepsFailed = new LinkedHashSet<>();
        this.events = new TraversalEventLog(eventLogCapacity);
        this.status = TraversalStatus.ROUTING;
    }

    /** For deserialization only. */
    private TraversalState() {
    }

    /** Starts a turn: every turn counter goes up by one. */
    public void beginTurn() {
        turnsSinceTransition++;
        turnsSinceProgress++;
        turnsElapsed++;
    }

    /** True once more turns than allowed have passed since the last transition. */
    public boolean isStale() {
        return turnsSinceTransition > staleAfterTurns;
    }

    /**
     * Moves to {@code to}: appends it to the path, resets the transition counter and, if the node
     * was visited before, resets its visit to pending. Records edge_followed then node_entered.
     */
    public void moveTo(String from, String to, EdgeCondition condition) {
        currentNode = to;
        path.add(to);
        turnsSinceTransition = 0;
        if (visits.containsKey(to)) {
            visits.put(to, NodeVisit.pending());
        }
        Map<String, String> edge = new LinkedHashMap<>();
        edge.put("from", from);
        edge.put("to", to);
        edge.put("condition", condition.toValue());
        record(TraversalEventType.EDGE_FOLLOWED, null, edge);
        record(TraversalEventType.NODE_ENTERED, to, Map.of());
    }

    /** Puts back the transition counter after moves that should not count as progress. */
    public void restoreTurnsSinceTransition(int turns) {
        turnsSinceTransition = turns;
    }

    /** Visit for the node, created pending on first use. */
    public NodeVisit visitFor(String nodeId) {
        return visits.computeIfAbsent(nodeId, id -> NodeVisit.pending());
    }

    /**
     * Counts a verified step. Only the first success of a node counts and resets the progress
     * counter; returns false for repeats, so cycling shows up as turns without progress.
     */
    public boolean recordCompletion(String nodeId) {
        if (!stepsCompleted.add(nodeId)) {
            return false;
        }
        completedNodes++;
        turnsSinceProgress = 0;
        return true;
    }

    /** Records an exhausted step; returns false if it was already recorded. */
    public boolean recordFailure(String nodeId) {
        return stepsFailed.add(nodeId);
    }

    public void record(TraversalEventType type, String nodeId, Map<String, String> attributes) {
        events.append(type, turnsElapsed, nodeId, attributes);
    }

    public String getPlanId() {
        return planId;
    }

    public String getPlanName() {
        return planName;
    }

    public int getStaleAfterTurns() {
        return staleAfterTurns;
    }

    public String getCurrentNode() {
        return currentNode;
    }

    /** Nodes entered in order, start first. Repeats allowed. */
    public List<String> getPath() {
        return Collections.unmodifiableList(path);
    }

    public Map<String, NodeVisit> getVisits() {
        return Collections.unmodifiableMap(visits);
    }

    /** Visit for the node, or null when it has none. */
    public NodeVisit getVisit(String nodeId) {
        return visits.get(nodeId);
    }

    public int getTurnsSinceTransition() {
        return turnsSinceTransition;
    }

    public int getTurnsSinceProgress() {
        return turnsSinceProgress;
    }

    public int getTurnsElapsed() {
        return turnsElapsed;
    }

    public int getCompletedNodes() {
        return completedNodes;
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    public Set<String> getStepsCompleted() {
        return Collections.unmodifiableSet(stepsCompleted);
    }

    public Set<String> getStepsFailed() {
        return Collections.unmodifiableSet(stepsFailed);
    }

    public TraversalEventLog getEvents() {
        return events;
    }

    public TraversalStatus getStatus() {
        return status;
    }

    public void setStatus(TraversalStatus status) {
        this.status = status != null ? status : TraversalStatus.ROUTING;
    }
}
