package com.pathwise.engine.verify;

import com.pathwise.planlibrary.verify.VerificationSpec;
import com.pathwise.planlibrary.verify.VerificationType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VerificationEvaluatorTest {

    private final VerificationEvaluator evaluator = new VerificationEvaluator();

    @Test
    void outputContains_isCaseInsensitive() {
        VerificationSpec spec = VerificationSpec.of(VerificationType.OUTPUT_CONTAINS, "Rolled Out");

        assertTrue(evaluator.verify(spec, "deployment successfully ROLLED OUT"));
        assertFalse(evaluator.verify(spec, "rollout pending"));
    }

    @Test
    void outputNotContains_passesWhenAbsent() {
        VerificationSpec spec = VerificationSpec.of(VerificationType.OUTPUT_NOT_CONTAINS, "failed");

        assertTrue(evaluator.verify(spec, "42 passed"));
        assertFalse(evaluator.verify(spec, "1 FAILED, 41 passed"));
    }

    @Test
    void exitCodeZero_rejectsErrorAndExitCodeMentions() {
        VerificationSpec spec = VerificationSpec.of(VerificationType.EXIT_CODE_ZERO, "");

        assertTrue(evaluator.verify(spec, "Build succeeded"));
        assertFalse(evaluator.verify(spec, "ERROR: cannot find symbol"));
        assertFalse(evaluator.verify(spec, "process finished with exit code 2"));
    }

    @Test
    void anyOutput_requiresNonBlankText() {
        VerificationSpec spec = VerificationSpec.of(VerificationType.ANY_OUTPUT, "");

        assertTrue(evaluator.verify(spec, "x"));
        assertFalse(evaluator.verify(spec, "   \n"));
        assertFalse(evaluator.verify(spec, null));
    }

    @Test
    void fileExistsAndManual_alwaysPass() {
        assertTrue(evaluator.verify(VerificationSpec.of(VerificationType.FILE_EXISTS, "/tmp/report.md"), ""));
        assertTrue(evaluator.verify(VerificationSpec.of(VerificationType.MANUAL, ""), ""));
    }

    @Test
    void missingSpec_alwaysPasses() {
        assertTrue(evaluator.verify(null, ""));
    }
}
