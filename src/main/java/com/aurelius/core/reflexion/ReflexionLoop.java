package com.aurelius.core.reflexion;

import com.aurelius.core.gate.DevGate;
import com.aurelius.core.gate.GateResult;
import com.aurelius.core.gate.ProductGate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * ReflexionLoop: turns a failed gate verdict into a repair plan and keeps
 * the retry budget for one goal run.
 *
 * Classification looks at four check names only, in priority order:
 *   tests_pass → determinism → lint → crv_pass
 * A check that was not recorded counts as passed, so a failure in any other
 * check classifies as UNKNOWN.
 */
public class ReflexionLoop {

    private static final Logger log = LoggerFactory.getLogger(ReflexionLoop.class);

    public static final int DEFAULT_MAX_RETRIES = 3;

    private final int maxRetries;
    private int attemptCount;

    public ReflexionLoop() {
        this(DEFAULT_MAX_RETRIES);
    }

    public ReflexionLoop(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.attemptCount = 0;
    }

    public RepairPlan analyzeFailure(GateResult result) {
        FailureType type = classify(result);
        RepairPlan plan = planFor(type);
        log.info("[Reflexion] Classified {} as {} (retry from {})",
                result, type.getCode(), plan.getRetryState().getName());
        return plan;
    }

    FailureType classify(GateResult result) {
        if (!result.check(DevGate.CHECK_TESTS, true)) {
            return FailureType.TEST_FAILURE;
        }
        if (!result.check(DevGate.CHECK_DETERMINISM, true)) {
            return FailureType.DETERMINISM_FAILURE;
        }
        if (!result.check(DevGate.CHECK_LINT, true)) {
            return FailureType.LINT_FAILURE;
        }
        if (!result.check(ProductGate.CHECK_CRV_PASS, true)) {
            return FailureType.CRV_FAILURE;
        }
        return FailureType.UNKNOWN;
    }

    private static RepairPlan planFor(FailureType type) {
        switch (type) {
            case TEST_FAILURE:
                return new RepairPlan(type,
                        "Tests failed - code quality issues detected",
                        List.of(
                                "Review test failures in gate details",
                                "Fix failing tests",
                                "Re-run dev gate"),
                        RetryStage.DEV_GATE);

            case DETERMINISM_FAILURE:
                return new RepairPlan(type,
                        "Determinism check failed - non-deterministic behavior detected",
                        List.of(
                                "Check for unseeded random number generators",
                                "Verify no system time dependencies",
                                "Ensure all operations are reproducible",
                                "Re-run determinism check"),
                        RetryStage.DEV_GATE);

            case LINT_FAILURE:
                return new RepairPlan(type,
                        "Lint check failed - code style issues detected",
                        List.of(
                                "Review lint errors in gate details",
                                "Fix lint warnings",
                                "Re-run lint check"),
                        RetryStage.DEV_GATE);

            case CRV_FAILURE:
                return new RepairPlan(type,
                        "CRV verification failed - strategy violates constraints",
                        List.of(
                                "Review CRV violations",
                                "Adjust strategy parameters to meet constraints",
                                "Re-run backtest",
                                "Re-run product gate"),
                        RetryStage.BACKTEST);

            case UNKNOWN:
            default:
                return new RepairPlan(FailureType.UNKNOWN,
                        "Unknown failure type",
                        List.of(
                                "Review error messages",
                                "Check logs for details",
                                "Consider manual intervention"),
                        RetryStage.INIT);
        }
    }

    public boolean shouldRetry() {
        return attemptCount < maxRetries;
    }

    public void incrementAttempt() {
        attemptCount++;
        log.info("[Reflexion] Attempt {}/{}", attemptCount, maxRetries);
    }

    public void reset() {
        attemptCount = 0;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Human-readable report: one ✓/✗ line per check in execution order,
     * then the accumulated errors.
     */
    public String generateFailureSummary(GateResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Failure Summary ===\n");
        sb.append("Gate Result: ").append(result).append("\n");
        sb.append("\n");
        sb.append("Failed Checks:\n");

        for (Map.Entry<String, Boolean> check : result.getChecks().entrySet()) {
            sb.append("  ").append(Boolean.TRUE.equals(check.getValue()) ? "✓" : "✗")
              .append(" ").append(check.getKey()).append("\n");
        }

        if (!result.getErrors().isEmpty()) {
            sb.append("\n");
            sb.append("Errors:\n");
            for (String error : result.getErrors()) {
                sb.append("  - ").append(error).append("\n");
            }
        }

        return sb.toString().stripTrailing();
    }
}
