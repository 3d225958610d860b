package com.pathwise.turn;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Backward scans over a {@link TurnHistory}.
 */
public final class TurnHistories {

    private TurnHistories() {
    }

    /**
     * Most recent tool result text, scanning from the newest record. Empty when no tool has run yet,
     * which is a normal "no output this turn" signal and not an error.
     */
    public static Optional<String> lastToolOutput(TurnHistory history) {
        if (history == null) return Optional.empty();
        List<TurnRecord> records = history.records();
        for (int i = records.size() - 1; i >= 0; i--) {
            TurnRecord r = records.get(i);
            if (r != null && r.isToolResult()) return Optional.of(r.text());
        }
        return Optional.empty();
    }

    /** Most recent user message, trimmed and lower-cased; empty string when there is none. */
    public static String lastUserMessage(TurnHistory history) {
        if (history == null) return "";
        List<TurnRecord> records = history.records();
        for (int i = records.size() - 1; i >= 0; i--) {
            TurnRecord r = records.get(i);
            if (r != null && r.role() == TurnRole.USER) return r.text().trim().toLowerCase(Locale.ROOT);
        }
        return "";
    }
}
