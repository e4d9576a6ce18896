package com.aurelius.core.reflexion;

import com.aurelius.core.gate.DevGate;
import com.aurelius.core.gate.GateResult;
import com.aurelius.core.gate.ProductGate;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReflexionLoopTest {

    private static GateResult devGateResult(boolean tests, boolean determinism, boolean lint, List<String> errors) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put(DevGate.CHECK_TESTS, tests);
        checks.put(DevGate.CHECK_DETERMINISM, determinism);
        checks.put(DevGate.CHECK_LINT, lint);
        return new GateResult(checks, errors, null);
    }

    @Test
    void testFailedTestsResumeFromDevGate() {
        ReflexionLoop loop = new ReflexionLoop();

        RepairPlan plan = loop.analyzeFailure(devGateResult(false, true, true, List.of("Tests failed: x")));

        assertEquals(FailureType.TEST_FAILURE, plan.getFailureType());
        assertEquals("test_failure", plan.getFailureType().getCode());
        assertEquals(RetryStage.DEV_GATE, plan.getRetryState());
        assertEquals("dev_gate", plan.getRetryState().getName());
        assertFalse(plan.getActions().isEmpty());
    }

    @Test
    void testRetryBudget() {
        ReflexionLoop loop = new ReflexionLoop(3);

        loop.incrementAttempt();
        loop.incrementAttempt();
        assertTrue(loop.shouldRetry());
        loop.incrementAttempt();
        assertFalse(loop.shouldRetry());
        assertEquals(3, loop.getAttemptCount());

        loop.reset();
        assertTrue(loop.shouldRetry());
        assertEquals(0, loop.getAttemptCount());
    }

    @Test
    void testZeroRetriesNeverRetries() {
        assertFalse(new ReflexionLoop(0).shouldRetry());
        assertThrows(IllegalArgumentException.class, () -> new ReflexionLoop(-1));
    }

    @Test
    void testClassificationPriority() {
        ReflexionLoop loop = new ReflexionLoop();

        assertEquals(FailureType.TEST_FAILURE, loop.classify(devGateResult(false, false, false, null)));
        assertEquals(FailureType.DETERMINISM_FAILURE, loop.classify(devGateResult(true, false, false, null)));
        assertEquals(FailureType.LINT_FAILURE, loop.classify(devGateResult(true, true, false, null)));
    }

    @Test
    void testCrvFailureResumesFromBacktest() {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put(ProductGate.CHECK_CRV_PASS, false);
        checks.put(ProductGate.CHECK_WALK_FORWARD, true);

        RepairPlan plan = new ReflexionLoop().analyzeFailure(new GateResult(checks, null, null));

        assertEquals(FailureType.CRV_FAILURE, plan.getFailureType());
        assertEquals(RetryStage.BACKTEST, plan.getRetryState());
        assertTrue(plan.getActions().contains("Re-run backtest"));
    }

    @Test
    void testUnrecognisedChecksAreUnknown() {
        GateResult missingReport = new GateResult(Map.of(ProductGate.CHECK_CRV_EXISTS, false), null, null);

        RepairPlan plan = new ReflexionLoop().analyzeFailure(missingReport);

        assertEquals(FailureType.UNKNOWN, plan.getFailureType());
        assertEquals(RetryStage.INIT, plan.getRetryState());
        assertEquals("Unknown failure type", plan.getDescription());
    }

    @Test
    void testFailureSummary() {
        GateResult result = devGateResult(false, true, true, List.of("Tests failed: 2 failures"));

        String summary = new ReflexionLoop().generateFailureSummary(result);

        assertEquals(String.join("\n",
                "=== Failure Summary ===",
                "Gate Result: Gate FAILED: 2/3 checks passed",
                "",
                "Failed Checks:",
                "  ✗ tests_pass",
                "  ✓ determinism",
                "  ✓ lint",
                "",
                "Errors:",
                "  - Tests failed: 2 failures"), summary);
    }

    @Test
    void testFailureSummaryWithoutErrors() {
        String summary = new ReflexionLoop().generateFailureSummary(devGateResult(true, true, false, null));

        assertFalse(summary.contains("Errors:"));
        assertTrue(summary.endsWith("  ✗ lint"));
    }
}
