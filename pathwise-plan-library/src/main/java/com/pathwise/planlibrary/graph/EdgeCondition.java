package com.pathwise.planlibrary.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Condition under which an edge is followed. JSON uses the lower-case snake name
 * ({@code on_success}); a missing condition means {@link #ALWAYS}. Unknown values are rejected.
 */
public enum EdgeCondition {
    ALWAYS,
    ON_SUCCESS,
    ON_RETRY,
    ON_EXHAUST,
    ON_FAIL;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EdgeCondition fromValue(String value) {
        if (value == null || value.isBlank()) return ALWAYS;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (EdgeCondition c : values()) {
            if (c.name().equals(normalized)) return c;
        }
        throw new IllegalArgumentException("Unknown edge condition: " + value);
    }

    /**
     * Condition a decision node follows for a verification outcome ({@code success} → {@link #ON_SUCCESS},
     * {@code fail} → {@link #ON_FAIL}). Empty when the outcome has no matching condition.
     */
    public static Optional<EdgeCondition> forOutcome(String outcome) {
        if (outcome == null || outcome.isBlank()) return Optional.empty();
        String normalized = ("on_" + outcome.trim()).toUpperCase(Locale.ROOT);
        for (EdgeCondition c : values()) {
            if (c.name().equals(normalized)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
