package com.pathwise.engine.event;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Bounded, append-only trace of traversal events. When full, the oldest event is evicted.
 * Not persisted beyond the session.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE)
public final class TraversalEventLog {

    public static final String OUTCOME = "outcome";
    public static final String DEFAULT_OUTCOME = "success";

    private int capacity;
    private ArrayDeque<TraversalEvent> events;

    public TraversalEventLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(capacity);
    }

    /** For deserialization only. */
    private TraversalEventLog() {
    }

    public void append(TraversalEvent event) {
        events.addLast(event);
        while (events.size() > capacity) {
            events.removeFirst();
        }
    }

    public void append(TraversalEventType type, int turn, String nodeId, Map<String, String> attributes) {
        append(new TraversalEvent(type, turn, nodeId, attributes));
    }

    /**
     * Outcome of the most recent {@link TraversalEventType#NODE_VERIFIED} event still in the log;
     * {@value #DEFAULT_OUTCOME} when none is recorded.
     */
    public String lastOutcome() {
        Iterator<TraversalEvent> it = events.descendingIterator();
        while (it.hasNext()) {
            TraversalEvent e = it.next();
            if (e.type() == TraversalEventType.NODE_VERIFIED) {
                String outcome = e.attribute(OUTCOME);
                return outcome != null ? outcome : DEFAULT_OUTCOME;
            }
        }
        return DEFAULT_OUTCOME;
    }

    /** Snapshot of the events, oldest first. */
    public List<TraversalEvent> events() {
        return List.copyOf(new ArrayList<>(events));
    }

    public int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }
}
