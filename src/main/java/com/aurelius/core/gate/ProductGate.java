package com.aurelius.core.gate;

import com.aurelius.core.tool.ToolCall;
import com.aurelius.core.tool.ToolContract;
import com.aurelius.core.tool.ToolResult;
import com.aurelius.core.tool.ToolType;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ProductGate: production-readiness checks over a finished backtest.
 *
 * Context: output_dir holding stats.json, trades.csv, equity_curve.csv and
 * crv_report.json. Without output_dir the gate fails immediately; it is the
 * only check that short-circuits, since no artifact path can be formed.
 *
 * Checks, in order:
 *   crv_exists / crv_pass - crv_verify against the configured drawdown limit
 *   walk_forward - placeholder
 *   stress_suite - placeholder
 */
public class ProductGate implements Gate {

    private static final Logger log = LoggerFactory.getLogger(ProductGate.class);

    public static final String NAME = "ProductGate";

    public static final String CHECK_OUTPUT_DIR   = "output_dir_provided";
    public static final String CHECK_CRV_EXISTS   = "crv_exists";
    public static final String CHECK_CRV_PASS     = "crv_pass";
    public static final String CHECK_WALK_FORWARD = "walk_forward";
    public static final String CHECK_STRESS_SUITE = "stress_suite";

    public static final String STATS_FILE      = "stats.json";
    public static final String TRADES_FILE     = "trades.csv";
    public static final String EQUITY_FILE     = "equity_curve.csv";
    public static final String CRV_REPORT_FILE = "crv_report.json";

    public static final double DEFAULT_MAX_DRAWDOWN_LIMIT = 0.25;

    private final ToolContract tools;
    private final double maxDrawdownLimit;
    private final List<ProductCheck> extraChecks;

    public ProductGate(ToolContract tools) {
        this(tools, DEFAULT_MAX_DRAWDOWN_LIMIT);
    }

    public ProductGate(ToolContract tools, double maxDrawdownLimit) {
        this(tools, maxDrawdownLimit, List.of(
                new PlaceholderCheck(CHECK_WALK_FORWARD),
                new PlaceholderCheck(CHECK_STRESS_SUITE)));
    }

    public ProductGate(ToolContract tools, double maxDrawdownLimit, List<ProductCheck> extraChecks) {
        this.tools = tools;
        this.maxDrawdownLimit = maxDrawdownLimit;
        this.extraChecks = List.copyOf(extraChecks);
    }

    @Override
    public String getName() {
        return NAME;
    }

    public double getMaxDrawdownLimit() {
        return maxDrawdownLimit;
    }

    @Override
    public GateResult run(Map<String, Object> context) {
        Object outputDirValue = context.get(CONTEXT_OUTPUT_DIR);
        if (outputDirValue == null || String.valueOf(outputDirValue).isBlank()) {
            log.warn("[ProductGate] output_dir not provided, skipping all checks");
            Map<String, Boolean> checks = new LinkedHashMap<>();
            checks.put(CHECK_OUTPUT_DIR, false);
            return new GateResult(checks, List.of("output_dir not provided in context"), null);
        }

        Path outputDir = Path.of(String.valueOf(outputDirValue));
        Map<String, Boolean> checks = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        Map<String, JsonNode> details = new LinkedHashMap<>();

        // 1. CRV verification
        log.info("[ProductGate] Running CRV verification...");
        Path crvPath = outputDir.resolve(CRV_REPORT_FILE);
        if (!Files.exists(crvPath)) {
            checks.put(CHECK_CRV_EXISTS, false);
            errors.add("CRV report not found");
            log.warn("[ProductGate] {}: FAIL ({} missing)", CHECK_CRV_EXISTS, crvPath);
        } else {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("stats_path", outputDir.resolve(STATS_FILE).toString());
            params.put("trades_path", outputDir.resolve(TRADES_FILE).toString());
            params.put("equity_path", outputDir.resolve(EQUITY_FILE).toString());
            params.put("max_drawdown_limit", maxDrawdownLimit);

            ToolResult crv = tools.invoke(new ToolCall(ToolType.CRV_VERIFY, params));
            checks.put(CHECK_CRV_PASS, crv.isSuccess());
            if (!crv.isSuccess()) {
                errors.add("CRV verification failed");
                errors.addAll(violationLines(crv.getOutput()));
            }
            details.put("crv", crv.getOutput());
            log.info("[ProductGate] {}: {}", CHECK_CRV_PASS, crv.isSuccess() ? "PASS" : "FAIL");
        }

        // 2..n pluggable checks
        for (ProductCheck check : extraChecks) {
            ProductCheck.Outcome outcome = check.evaluate(outputDir);
            checks.put(check.getName(), outcome.isPassed());
            if (!outcome.isPassed() && outcome.getError() != null) {
                errors.add(outcome.getError());
            }
            details.put(check.getName(), outcome.getDetail());
            log.info("[ProductGate] {}: {}", check.getName(), outcome.isPassed() ? "PASS" : "FAIL");
        }

        GateResult result = new GateResult(checks, errors, details);
        log.info("[ProductGate] {}", result);
        return result;
    }

    /**
     * One "  - rule_id: message" line per entry in crv_report.violations.
     */
    static List<String> violationLines(JsonNode output) {
        List<String> lines = new ArrayList<>();
        if (output == null) {
            return lines;
        }
        JsonNode violations = output.path("crv_report").path("violations");
        if (!violations.isArray()) {
            return lines;
        }
        for (JsonNode v : violations) {
            lines.add("  - " + v.path("rule_id").asText() + ": " + v.path("message").asText());
        }
        return lines;
    }
}
