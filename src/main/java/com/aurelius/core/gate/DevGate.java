package com.aurelius.core.gate;

import com.aurelius.core.tool.ToolCall;
import com.aurelius.core.tool.ToolContract;
import com.aurelius.core.tool.ToolResult;
import com.aurelius.core.tool.ToolType;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DevGate: tests, determinism and lint, always all three and in that order.
 *
 * A failing check never stops the later ones: every run reports the full
 * set of diagnostics.
 *
 * Context: spec_path and data_path (determinism check only).
 */
public class DevGate implements Gate {

    private static final Logger log = LoggerFactory.getLogger(DevGate.class);

    public static final String NAME = "DevGate";

    public static final String CHECK_TESTS       = "tests_pass";
    public static final String CHECK_DETERMINISM = "determinism";
    public static final String CHECK_LINT        = "lint";

    static final int DETERMINISM_RUNS = 3;

    private final ToolContract tools;

    public DevGate(ToolContract tools) {
        this.tools = tools;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public GateResult run(Map<String, Object> context) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        Map<String, JsonNode> details = new LinkedHashMap<>();

        // 1. tests
        log.info("[DevGate] Running tests...");
        ToolResult tests = tools.invoke(ToolCall.of(ToolType.RUN_TESTS));
        record(CHECK_TESTS, tests, "Tests failed", checks, errors, details);

        // 2. determinism
        log.info("[DevGate] Checking determinism...");
        Object specPath = context.get(CONTEXT_SPEC_PATH);
        Object dataPath = context.get(CONTEXT_DATA_PATH);

        if (isPresent(specPath) && isPresent(dataPath)) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put(CONTEXT_SPEC_PATH, String.valueOf(specPath));
            params.put(CONTEXT_DATA_PATH, String.valueOf(dataPath));
            params.put("runs", DETERMINISM_RUNS);

            ToolResult determinism = tools.invoke(new ToolCall(ToolType.CHECK_DETERMINISM, params));
            record(CHECK_DETERMINISM, determinism, "Determinism check failed", checks, errors, details);
        } else {
            checks.put(CHECK_DETERMINISM, false);
            errors.add("Missing spec_path or data_path for determinism check");
            log.warn("[DevGate] determinism: FAIL (missing spec_path or data_path)");
        }

        // 3. lint
        log.info("[DevGate] Running lint...");
        ToolResult lint = tools.invoke(ToolCall.of(ToolType.LINT));
        record(CHECK_LINT, lint, "Lint failed", checks, errors, details);

        GateResult result = new GateResult(checks, errors, details);
        log.info("[DevGate] {}", result);
        return result;
    }

    private static void record(String check,
                               ToolResult result,
                               String failurePrefix,
                               Map<String, Boolean> checks,
                               List<String> errors,
                               Map<String, JsonNode> details) {
        checks.put(check, result.isSuccess());
        if (!result.isSuccess()) {
            errors.add(failurePrefix + ": " + result.getError());
        }
        details.put(check, result.getOutput());
        log.info("[DevGate] {}: {}", check, result.isSuccess() ? "PASS" : "FAIL");
    }

    private static boolean isPresent(Object value) {
        return value != null && !String.valueOf(value).isBlank();
    }
}
