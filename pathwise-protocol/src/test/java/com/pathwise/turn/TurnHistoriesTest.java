package com.pathwise.turn;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TurnHistoriesTest {

    @Test
    void lastToolOutput_returnsNewestToolResult() {
        TurnHistory history = TurnHistory.of(List.of(
                TurnRecord.user("run the tests"),
                TurnRecord.toolResult("terminal", "3 failed"),
                TurnRecord.agent("fixing"),
                TurnRecord.toolResult("terminal", "all passed"),
                TurnRecord.agent("done")));

        assertEquals(Optional.of("all passed"), TurnHistories.lastToolOutput(history));
    }

    @Test
    void lastToolOutput_emptyWhenNoToolHasRun() {
        TurnHistory history = TurnHistory.of(List.of(TurnRecord.user("hello"), TurnRecord.agent("hi")));

        assertTrue(TurnHistories.lastToolOutput(history).isEmpty());
        assertTrue(TurnHistories.lastToolOutput(TurnHistory.EMPTY).isEmpty());
        assertTrue(TurnHistories.lastToolOutput(null).isEmpty());
    }

    @Test
    void lastUserMessage_isTrimmedAndLowerCased() {
        TurnHistory history = TurnHistory.of(List.of(
                TurnRecord.user("first"),
                TurnRecord.agent("ok"),
                TurnRecord.user("  My Tests FAIL  "),
                TurnRecord.toolResult("terminal", "output")));

        assertEquals("my tests fail", TurnHistories.lastUserMessage(history));
    }

    @Test
    void lastUserMessage_lowerCasesIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            TurnHistory history = TurnHistory.of(List.of(TurnRecord.user("FIX THIS")));

            assertEquals("fix this", TurnHistories.lastUserMessage(history));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void lastUserMessage_emptyWithoutUserTurns() {
        assertEquals("", TurnHistories.lastUserMessage(TurnHistory.EMPTY));
        assertEquals("", TurnHistories.lastUserMessage(TurnHistory.of(List.of(TurnRecord.agent("hi")))));
    }
}
