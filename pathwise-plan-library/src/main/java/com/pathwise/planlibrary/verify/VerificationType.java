package com.pathwise.planlibrary.verify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of check applied to a task's tool output. JSON uses the lower-case snake name;
 * a missing type means {@link #ANY_OUTPUT}. Unknown values are rejected.
 */
public enum VerificationType {
    OUTPUT_CONTAINS,
    OUTPUT_NOT_CONTAINS,
    /** Heuristic: output mentions neither "error" nor "exit code". */
    EXIT_CODE_ZERO,
    ANY_OUTPUT,
    /** Confirmed outside the engine; always passes here. */
    FILE_EXISTS,
    /** Self-reported by the agent; always passes here. */
    MANUAL;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VerificationType fromValue(String value) {
        if (value == null || value.isBlank()) return ANY_OUTPUT;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (VerificationType t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        throw new IllegalArgumentException("Unknown verification type: " + value);
    }
}
