package com.pathwise.planlibrary.verify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Verification attached to a task node: a type and, for substring checks, the value to look for. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class VerificationSpec {

    private final VerificationType type;
    private final String value;

    @JsonCreator
    public VerificationSpec(
            @JsonProperty("type") VerificationType type,
            @JsonProperty("value") String value) {
        this.type = type != null ? type : VerificationType.ANY_OUTPUT;
        this.value = value != null ? value : "";
    }

    public static VerificationSpec of(VerificationType type, String value) {
        return new VerificationSpec(type, value);
    }

    public VerificationType getType() {
        return type;
    }

    /** Substring for contains checks; empty string when not set. */
    public String getValue() {
        return value;
    }

    /** Short form for status rendering, e.g. {@code output_contains: PASSED}. */
    public String describe() {
        return value.isEmpty() ? type.toValue() : type.toValue() + ": " + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VerificationSpec that = (VerificationSpec) o;
        return type == that.type && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }
}
