package me.golemcore.datapilot.adapter.outbound.sandbox;

import me.golemcore.datapilot.domain.model.FailureKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FailureClassifierTest {

    private final FailureClassifier classifier = new FailureClassifier();

    @Test
    void shouldAcceptSucceededResponseWithZeroExit() {
        RunnerMessages.RunnerResponse response = new RunnerMessages.RunnerResponse();
        response.setStatus("succeeded");

        RunnerAttempt attempt = classifier.classify(0, response, "out", "");

        assertTrue(attempt.succeeded());
    }

    @Test
    void shouldNotTrustSucceededResponseWithNonZeroExit() {
        RunnerMessages.RunnerResponse response = new RunnerMessages.RunnerResponse();
        response.setStatus("succeeded");

        RunnerAttempt attempt = classifier.classify(2, response, "", "Traceback\nValueError: bad input");

        assertEquals(FailureKind.RUNTIME_ERROR, attempt.failureKind());
        assertEquals("Runner exited with code 2: ValueError: bad input", attempt.summary());
    }

    @Test
    void shouldPreferKindReportedByRunner() {
        RunnerMessages.RunnerResponse response = new RunnerMessages.RunnerResponse();
        response.setStatus("failed");
        response.setError(new RunnerMessages.RunnerError("resource_exhausted", "matrix too large", null, null));

        RunnerAttempt attempt = classifier.classify(1, response, "", "stack");

        assertEquals(FailureKind.RESOURCE_EXHAUSTED, attempt.failureKind());
        assertEquals("matrix too large", attempt.summary());
        assertEquals("stack", attempt.detail());
    }

    @Test
    void shouldNotLetRunnerClaimTimeoutOrCancellation() {
        assertEquals(FailureKind.RUNTIME_ERROR, FailureClassifier.parseKind("timeout"));
        assertEquals(FailureKind.RUNTIME_ERROR, FailureClassifier.parseKind("CANCELLED"));
        assertEquals(FailureKind.RUNTIME_ERROR, FailureClassifier.parseKind("exploded"));
        assertEquals(FailureKind.DEPENDENCY_MISSING, FailureClassifier.parseKind(" dependency_missing "));
    }

    @Test
    void shouldTakeMissingPackageFromRunnerError() {
        RunnerMessages.RunnerResponse response = new RunnerMessages.RunnerResponse();
        response.setError(new RunnerMessages.RunnerError("dependency_missing", "No module named 'shap'", null,
                null));

        RunnerAttempt attempt = classifier.classify(1, response, "", "");

        assertEquals(FailureKind.DEPENDENCY_MISSING, attempt.failureKind());
        assertEquals("shap", attempt.missingPackage());
    }

    @Test
    void shouldClassifyKilledProcessAsResourceExhausted() {
        assertEquals(FailureKind.RESOURCE_EXHAUSTED, classifier.classify(137, null, "", "").failureKind());
        assertEquals(FailureKind.RESOURCE_EXHAUSTED,
                classifier.classify(1, null, "", "numpy.core._exceptions.MemoryError: Unable to allocate")
                        .failureKind());
    }

    @Test
    void shouldDetectMissingModuleInStderr() {
        RunnerAttempt attempt = classifier.classify(1, null, "",
                "ModuleNotFoundError: No module named 'sklearn.ensemble'");

        assertEquals(FailureKind.DEPENDENCY_MISSING, attempt.failureKind());
        assertEquals("scikit-learn", attempt.missingPackage());
    }

    @Test
    void shouldReportSilentExitAsRuntimeError() {
        RunnerAttempt attempt = classifier.classify(0, null, "", "");

        assertEquals(FailureKind.RUNTIME_ERROR, attempt.failureKind());
        assertEquals("Runner exited without reporting a result", attempt.summary());
    }

    @Test
    void shouldIgnoreUnrelatedTextWhenFindingMissingPackage() {
        assertNull(FailureClassifier.missingPackage("KeyError: 'churn'"));
        assertNull(FailureClassifier.missingPackage(null));
        assertEquals("pyyaml", FailureClassifier.missingPackage("No module named yaml"));
    }
}
