package com.pathwise.turn;

import java.util.Objects;

/**
 * One entry of the host's turn history. Tool results carry the tool name; other roles leave it null.
 */
public record TurnRecord(TurnRole role, String text, String toolName) {

    public TurnRecord {
        Objects.requireNonNull(role, "role");
        text = text != null ? text : "";
    }

    public static TurnRecord user(String text) {
        return new TurnRecord(TurnRole.USER, text, null);
    }

    public static TurnRecord agent(String text) {
        return new TurnRecord(TurnRole.AGENT, text, null);
    }

    public static TurnRecord toolResult(String toolName, String output) {
        return new TurnRecord(TurnRole.TOOL, output, toolName);
    }

    public boolean isToolResult() {
        return role == TurnRole.TOOL;
    }
}
