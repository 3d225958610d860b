package com.pathwise.turn;

/** Who produced a turn record. */
public enum TurnRole {
    USER,
    AGENT,
    /** Result of a tool invocation. */
    TOOL
}
