package com.pathwise.planlibrary.load;

import java.util.List;

/**
 * Thrown when a plan library document parses but describes graphs the engine cannot traverse
 * (missing start, dangling edges, invalid limits). Lists every problem found.
 */
public final class PlanLibraryValidationException extends IllegalStateException {

    private final List<String> problems;

    public PlanLibraryValidationException(List<String> problems) {
        super("Invalid plan library: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
