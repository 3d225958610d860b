package com.pathwise.engine.event;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TraversalEventLogTest {

    @Test
    void append_evictsOldestWhenFull() {
        TraversalEventLog log = new TraversalEventLog(3);
        for (int turn = 0; turn < 5; turn++) {
            log.append(TraversalEventType.NODE_ENTERED, turn, "n" + turn, Map.of());
        }

        List<TraversalEvent> events = log.events();

        assertEquals(3, events.size());
        assertEquals(List.of("n2", "n3", "n4"), events.stream().map(TraversalEvent::nodeId).toList());
    }

    @Test
    void lastOutcome_defaultsToSuccess() {
        TraversalEventLog log = new TraversalEventLog(10);
        log.append(TraversalEventType.NODE_ENTERED, 0, "a", Map.of());

        assertEquals("success", log.lastOutcome());
    }

    @Test
    void lastOutcome_usesMostRecentVerification() {
        TraversalEventLog log = new TraversalEventLog(10);
        log.append(TraversalEventType.NODE_VERIFIED, 1, "a", Map.of("outcome", "success"));
        log.append(TraversalEventType.NODE_VERIFIED, 2, "b", Map.of("outcome", "fail"));
        log.append(TraversalEventType.EDGE_FOLLOWED, 2, null, Map.of("from", "b", "to", "c", "condition", "on_fail"));

        assertEquals("fail", log.lastOutcome());
    }

    @Test
    void lastOutcome_forgetsEvictedVerifications() {
        TraversalEventLog log = new TraversalEventLog(2);
        log.append(TraversalEventType.NODE_VERIFIED, 1, "a", Map.of("outcome", "fail"));
        log.append(TraversalEventType.NODE_ENTERED, 1, "b", Map.of());
        log.append(TraversalEventType.NODE_ENTERED, 1, "c", Map.of());

        assertEquals("success", log.lastOutcome());
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new TraversalEventLog(0));
    }
}
