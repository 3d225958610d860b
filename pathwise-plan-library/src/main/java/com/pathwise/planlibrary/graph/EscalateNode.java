package com.pathwise.planlibrary.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Terminal node that hands the session to a higher-severity process. Reaching it sets the
 * session pace level and ends the plan.
 */
public final class EscalateNode extends GraphNode {

    public static final String DEFAULT_REASON = "Plan escalated";

    private final String paceLevel;
    private final String reason;

    @JsonCreator
    public EscalateNode(
            @JsonProperty("name") String name,
            @JsonProperty("pace_level") String paceLevel,
            @JsonProperty("reason") String reason) {
        super(name);
        this.paceLevel = paceLevel != null && !paceLevel.isBlank() ? paceLevel.trim() : null;
        this.reason = reason != null && !reason.isBlank() ? reason : DEFAULT_REASON;
    }

    @Override
    public NodeType getType() {
        return NodeType.ESCALATE;
    }

    /** Declared pace level, or null when the plan leaves it to the engine default. */
    @JsonProperty("pace_level")
    public String getPaceLevel() {
        return paceLevel;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EscalateNode that = (EscalateNode) o;
        return Objects.equals(getName(), that.getName())
                && Objects.equals(paceLevel, that.paceLevel)
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), paceLevel, reason);
    }
}
