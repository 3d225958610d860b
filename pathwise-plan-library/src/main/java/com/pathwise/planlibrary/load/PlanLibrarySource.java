package com.pathwise.planlibrary.load;

import java.util.Optional;

/**
 * External source of the plan library document (e.g. a shared store), consulted before local files.
 * Implementations are provided by the host.
 */
public interface PlanLibrarySource {

    /** Source that never has a document. */
    PlanLibrarySource NONE = () -> Optional.empty();

    /**
     * Gets the plan library JSON.
     *
     * @return the document if present
     */
    Optional<String> fetch();

    /** Label used in log lines. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
