package com.pathwise.planlibrary.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Directed, conditioned transition between two nodes of a plan graph. */
public final class EdgeDefinition {

    private final String from;
    private final String to;
    private final EdgeCondition condition;

    @JsonCreator
    public EdgeDefinition(
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("condition") EdgeCondition condition) {
        this.from = from;
        this.to = to;
        this.condition = condition != null ? condition : EdgeCondition.ALWAYS;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    /** Never null; defaults to {@link EdgeCondition#ALWAYS}. */
    public EdgeCondition getCondition() {
        return condition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeDefinition that = (EdgeDefinition) o;
        return Objects.equals(from, that.from) && Objects.equals(to, that.to) && condition == that.condition;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, condition);
    }

    @Override
    public String toString() {
        return from + " -(" + condition.toValue() + ")-> " + to;
    }
}
