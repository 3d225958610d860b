package com.pathwise.engine.event;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Kinds of traversal events. */
public enum TraversalEventType {
    PLAN_ACTIVATED,
    NODE_ENTERED,
    /** Carries {@code outcome} ({@code success} or {@code fail}). */
    NODE_VERIFIED,
    RETRY_TRIGGERED,
    /** Carries {@code from}, {@code to} and {@code condition}. */
    EDGE_FOLLOWED,
    PLAN_EXPIRED,
    PLAN_COMPLETED,
    /** Carries {@code reason} and {@code pace_level}. */
    PLAN_ESCALATED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
