package com.pathwise.engine.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the traversal trace.
 *
 * @param type       event kind
 * @param turn       turns elapsed since activation when the event was recorded
 * @param nodeId     node the event concerns (may be null for edge events)
 * @param attributes kind-specific fields (e.g. {@code outcome}, {@code condition})
 */
public record TraversalEvent(TraversalEventType type, int turn, String nodeId, Map<String, String> attributes) {

    public TraversalEvent {
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }

    /** Attribute value or null. */
    public String attribute(String key) {
        return attributes.get(key);
    }
}
