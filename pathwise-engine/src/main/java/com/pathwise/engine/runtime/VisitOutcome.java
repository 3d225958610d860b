package com.pathwise.engine.runtime;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of the current visit to a node. Each fresh entry starts at {@link #PENDING}.
 */
public enum VisitOutcome {
    PENDING,
    /** Verification passed. */
    SUCCESS,
    /** Verification failed and the retry budget is used up. */
    FAIL;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
