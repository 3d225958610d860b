package com.pathwise.engine.verify;

import com.pathwise.planlibrary.verify.VerificationSpec;

import java.util.Locale;

/**
 * Decides whether a tool output satisfies a task's verification rule. Text comparisons are
 * case-insensitive. A task without a rule always passes.
 */
public final class VerificationEvaluator {

    public boolean verify(VerificationSpec spec, String output) {
        if (spec == null) {
            return true;
        }
        String text = output != null ? output.toLowerCase(Locale.ROOT) : "";
        String value = spec.getValue().toLowerCase(Locale.ROOT);
        return switch (spec.getType()) {
            case OUTPUT_CONTAINS -> text.contains(value);
            case OUTPUT_NOT_CONTAINS -> !text.contains(value);
            case EXIT_CODE_ZERO -> !text.contains("error") && !text.contains("exit code");
            case ANY_OUTPUT -> !text.isBlank();
            // Not checked against the filesystem or a human; always passes.
            case FILE_EXISTS, MANUAL -> true;
        };
    }
}
