package com.pathwise.turn;

import java.util.List;

/**
 * Ordered turn records of a session, oldest first. Provided by the host loop; read-only here.
 */
public interface TurnHistory {

    /** Empty history (no turns yet). */
    TurnHistory EMPTY = List::of;

    List<TurnRecord> records();

    static TurnHistory of(List<TurnRecord> records) {
        List<TurnRecord> copy = List.copyOf(records);
        return () -> copy;
    }
}
