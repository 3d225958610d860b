package com.pathwise.planlibrary.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pathwise.planlibrary.verify.VerificationSpec;

import java.util.Objects;

/**
 * Actionable step. The agent performs {@link #getAction()} (optionally with {@link #getTool()}),
 * and the next tool output is checked against {@link #getVerify()}. A failed check is retried until
 * attempts exceed {@link #getMaxRetries()}.
 */
public final class TaskNode extends GraphNode {

    private final String action;
    private final String tool;
    private final String toolHint;
    private final VerificationSpec verify;
    private final int maxRetries;

    public TaskNode(String name, String action, String tool, String toolHint,
                    VerificationSpec verify, Integer maxRetries) {
        super(name);
        this.action = action != null ? action : "";
        this.tool = tool;
        this.toolHint = toolHint;
        this.verify = verify;
        this.maxRetries = maxRetries != null ? maxRetries : 0;
    }

    /**
     * JSON creator. Untagged nodes and unknown tags both arrive here (task is the default variant),
     * so any tag other than {@code task} is rejected.
     */
    @JsonCreator
    static TaskNode fromJson(
            @JsonProperty("type") String type,
            @JsonProperty("name") String name,
            @JsonProperty("action") String action,
            @JsonProperty("tool") String tool,
            @JsonProperty("tool_hint") String toolHint,
            @JsonProperty("verify") VerificationSpec verify,
            @JsonProperty("max_retries") Integer maxRetries) {
        if (type != null && !type.isBlank() && !NodeType.TASK.toValue().equals(type.trim())) {
            throw new IllegalArgumentException("Unknown node type: " + type);
        }
        return new TaskNode(name, action, tool, toolHint, verify, maxRetries);
    }

    @Override
    public NodeType getType() {
        return NodeType.TASK;
    }

    public String getAction() {
        return action;
    }

    /** Tool the agent is expected to call (optional). */
    public String getTool() {
        return tool;
    }

    @JsonProperty("tool_hint")
    public String getToolHint() {
        return toolHint;
    }

    /** Verification applied to tool output; null means any output passes. */
    public VerificationSpec getVerify() {
        return verify;
    }

    @JsonProperty("max_retries")
    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskNode that = (TaskNode) o;
        return maxRetries == that.maxRetries
                && Objects.equals(getName(), that.getName())
                && Objects.equals(action, that.action)
                && Objects.equals(tool, that.tool)
                && Objects.equals(toolHint, that.toolHint)
                && Objects.equals(verify, that.verify);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), action, tool, toolHint, verify, maxRetries);
    }
}
