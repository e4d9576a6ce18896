package com.aurelius.orchestrator;

import com.aurelius.core.fsm.GoalGuardStateMachine;
import com.aurelius.core.fsm.GuardedToolContract;
import com.aurelius.core.fsm.State;
import com.aurelius.core.gate.DevGate;
import com.aurelius.core.gate.Gate;
import com.aurelius.core.gate.GateResult;
import com.aurelius.core.gate.ProductGate;
import com.aurelius.core.reflexion.ReflexionLoop;
import com.aurelius.core.reflexion.RepairPlan;
import com.aurelius.core.reflexion.RetryStage;
import com.aurelius.core.strict.StrictMode;
import com.aurelius.core.tool.ArtifactIds;
import com.aurelius.core.tool.ToolCall;
import com.aurelius.core.tool.ToolContract;
import com.aurelius.core.tool.ToolContractFactory;
import com.aurelius.core.tool.ToolResult;
import com.aurelius.core.tool.ToolType;
import com.aurelius.orchestrator.dto.GoalRequest;
import com.aurelius.orchestrator.dto.GoalRunResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * GoalOrchestrator: drives one goal from strategy generation to commit.
 *
 * Step flow:  GENERATE → BACKTEST → DEV_GATE → PRODUCT_GATE → COMMIT
 *
 * Every tool call, including the ones made inside gates, goes through a
 * GuardedToolContract, so the goal guard both enforces ordering and records
 * the path. Gate verdicts are applied with forced transitions.
 *
 * A failed gate goes to the reflexion loop. While the retry budget lasts the
 * machine is forced to the plan's resume state and the matching step runs
 * again; once it is spent the run ends in ERROR with the last repair plan.
 *
 * Each run owns a fresh state machine and reflexion loop; the orchestrator
 * itself holds only configuration.
 */
@Component
public class GoalOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GoalOrchestrator.class);

    private static final DateTimeFormatter RUN_DIR_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final int MAX_SLUG_LENGTH = 40;

    private enum Step {
        GENERATE,
        BACKTEST,
        DEV_GATE,
        PRODUCT_GATE,
        COMMIT
    }

    private final ToolContractFactory toolContractFactory;
    private final ObjectMapper mapper;
    private final Path outputRoot;
    private final int maxRetries;
    private final double defaultMaxDrawdownLimit;
    private final boolean defaultStrictMode;

    public GoalOrchestrator(
            ToolContractFactory toolContractFactory,
            ObjectMapper mapper,
            @Value("${aurelius.output.root:runs}") String outputRoot,
            @Value("${aurelius.reflexion.max-retries:3}") int maxRetries,
            @Value("${aurelius.gate.max-drawdown-limit:0.25}") double defaultMaxDrawdownLimit,
            @Value("${aurelius.strict-mode:true}") boolean defaultStrictMode
    ) {
        this.toolContractFactory     = toolContractFactory;
        this.mapper                  = mapper;
        this.outputRoot              = Path.of(outputRoot);
        this.maxRetries              = maxRetries;
        this.defaultMaxDrawdownLimit = defaultMaxDrawdownLimit;
        this.defaultStrictMode       = defaultStrictMode;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public GoalRunResult runGoal(GoalRequest request) {
        ToolContract tools = toolContractFactory.create(request.getEngineCli(), request.getMemoryCli());
        return runGoal(request, tools);
    }

    public GoalRunResult runGoal(GoalRequest request, ToolContract tools) {

        String goal = request.getGoal();
        log.info("========== GOAL START: {} ==========", goal);
        long startTime = System.currentTimeMillis();

        GoalGuardStateMachine fsm       = new GoalGuardStateMachine();
        ReflexionLoop         reflexion = new ReflexionLoop(maxRetries);
        ToolContract          guarded   = new GuardedToolContract(tools, fsm);

        double limit = request.getMaxDrawdownLimit() != null
                ? request.getMaxDrawdownLimit()
                : defaultMaxDrawdownLimit;
        StrictMode strict = new StrictMode(request.getStrictMode() != null
                ? request.getStrictMode()
                : defaultStrictMode);

        DevGate     devGate     = new DevGate(guarded);
        ProductGate productGate = new ProductGate(guarded, limit);

        Path outputDir;
        try {
            outputDir = createRunDirectory(goal);
        } catch (IOException e) {
            log.error("[Orchestrator] Could not create output directory under {}", outputRoot, e);
            fsm.toErrorState();
            return failResult(goal, fsm, reflexion, null,
                    "Could not create output directory: " + e.getMessage(), null, null);
        }

        Map<String, Object> context = new HashMap<>();
        context.put(Gate.CONTEXT_DATA_PATH, request.getDataPath());
        context.put(Gate.CONTEXT_OUTPUT_DIR, outputDir.toString());

        Step step = Step.GENERATE;

        while (true) {
            switch (step) {

                // -------------------------------------------------------------
                // 1. strategy generation
                // -------------------------------------------------------------
                case GENERATE: {
                    Map<String, Object> params = new LinkedHashMap<>();
                    params.put("goal", goal);
                    params.put("output_dir", outputDir.toString());

                    ToolResult generated = guarded.invoke(new ToolCall(ToolType.GENERATE_STRATEGY, params));
                    if (!generated.isSuccess()) {
                        return abort(goal, fsm, reflexion, outputDir, "Strategy generation failed: " + generated.getError());
                    }
                    String specPath = generated.hasOutput()
                            ? generated.getOutput().path(Gate.CONTEXT_SPEC_PATH).asText(null)
                            : null;
                    if (specPath == null) {
                        return abort(goal, fsm, reflexion, outputDir, "Strategy generation returned no spec_path");
                    }
                    context.put(Gate.CONTEXT_SPEC_PATH, specPath);
                    log.info("[Orchestrator] Strategy spec {} (artifact {})", specPath, generated.getArtifactId());
                    step = Step.BACKTEST;
                    break;
                }

                // -------------------------------------------------------------
                // 2. backtest
                // -------------------------------------------------------------
                case BACKTEST: {
                    Map<String, Object> params = new LinkedHashMap<>();
                    params.put(Gate.CONTEXT_SPEC_PATH, context.get(Gate.CONTEXT_SPEC_PATH));
                    params.put(Gate.CONTEXT_DATA_PATH, request.getDataPath());
                    params.put(Gate.CONTEXT_OUTPUT_DIR, outputDir.toString());

                    ToolResult backtest = guarded.invoke(new ToolCall(ToolType.BACKTEST, params));
                    if (!backtest.isSuccess()) {
                        return abort(goal, fsm, reflexion, outputDir, "Backtest failed: " + backtest.getError());
                    }
                    step = Step.DEV_GATE;
                    break;
                }

                // -------------------------------------------------------------
                // 3. dev gate (its first run_tests moves BACKTEST_COMPLETE → DEV_GATE)
                // -------------------------------------------------------------
                case DEV_GATE: {
                    GateResult verdict = devGate.run(context);
                    if (verdict.isPassed()) {
                        fsm.forceTransition(State.DEV_GATE_PASSED);
                        step = Step.PRODUCT_GATE;
                        break;
                    }
                    RepairPlan plan = analyze(devGate, verdict, fsm, reflexion);
                    Step resume = resumeStep(plan, fsm, reflexion);
                    if (resume == null) {
                        return exhausted(goal, fsm, reflexion, outputDir, devGate, verdict, plan);
                    }
                    step = resume;
                    break;
                }

                // -------------------------------------------------------------
                // 4. product gate (its crv_verify moves DEV_GATE_PASSED → PRODUCT_GATE)
                // -------------------------------------------------------------
                case PRODUCT_GATE: {
                    GateResult verdict = productGate.run(context);
                    if (verdict.isPassed()) {
                        fsm.forceTransition(State.PRODUCT_GATE_PASSED);
                        step = Step.COMMIT;
                        break;
                    }
                    RepairPlan plan = analyze(productGate, verdict, fsm, reflexion);
                    Step resume = resumeStep(plan, fsm, reflexion);
                    if (resume == null) {
                        return exhausted(goal, fsm, reflexion, outputDir, productGate, verdict, plan);
                    }
                    step = resume;
                    break;
                }

                // -------------------------------------------------------------
                // 5. commit
                // -------------------------------------------------------------
                case COMMIT: {
                    Map<String, Object> params = new LinkedHashMap<>();
                    params.put("message", goal);
                    params.put("artifact_path", outputDir.toString());

                    ToolResult commit = guarded.invoke(new ToolCall(ToolType.MEMORY_COMMIT, params));
                    if (!commit.isSuccess()) {
                        return abort(goal, fsm, reflexion, outputDir, "Commit failed: " + commit.getError());
                    }

                    log.info("========== GOAL COMMITTED ({} ms) ==========",
                            System.currentTimeMillis() - startTime);
                    return successResult(goal, fsm, reflexion, outputDir, commit.getArtifactId(), strict);
                }

                default:
                    throw new IllegalStateException("Unhandled step: " + step);
            }
        }
    }

    // =========================================================================
    // REFLEXION
    // =========================================================================

    private RepairPlan analyze(Gate gate,
                               GateResult verdict,
                               GoalGuardStateMachine fsm,
                               ReflexionLoop reflexion) {
        log.warn("[Orchestrator] {} failed: {}", gate.getName(), verdict);
        verdict.getErrors().forEach(e -> log.warn("[Orchestrator]   {}", e));

        RepairPlan plan = reflexion.analyzeFailure(verdict);
        fsm.toReflexionState();
        return plan;
    }

    /**
     * @return the step to resume from, or null when the retry budget is spent
     */
    private Step resumeStep(RepairPlan plan, GoalGuardStateMachine fsm, ReflexionLoop reflexion) {
        if (!reflexion.shouldRetry()) {
            log.error("[Orchestrator] Retry budget exhausted ({}/{})",
                    reflexion.getAttemptCount(), reflexion.getMaxRetries());
            return null;
        }

        reflexion.incrementAttempt();
        RetryStage stage = plan.getRetryState();
        fsm.forceTransition(stage.getResumeState());
        log.info("[Orchestrator] Retrying from {} ({})", stage.getName(), plan.getFailureType().getCode());

        switch (stage) {
            case INIT:
                return Step.GENERATE;
            case BACKTEST:
                return Step.BACKTEST;
            case DEV_GATE:
            default:
                return Step.DEV_GATE;
        }
    }

    // =========================================================================
    // RESULT BUILDERS
    // =========================================================================

    private GoalRunResult successResult(String goal,
                                        GoalGuardStateMachine fsm,
                                        ReflexionLoop reflexion,
                                        Path outputDir,
                                        String artifactId,
                                        StrictMode strict) {
        String response;
        if (strict.isEnabled()) {
            List<String> ids = ArtifactIds.isArtifactId(artifactId) ? List.of(artifactId) : List.of();
            response = strict.formatArtifactResponse(ids, "Committed");
            if (!strict.validateResponse(response)) {
                log.warn("[Orchestrator] Strict-mode response failed validation, withholding it: {}", response);
                response = strict.formatArtifactResponse(List.of(), null);
            }
        } else {
            response = "Goal committed" + (artifactId != null ? ": " + artifactId : "");
        }

        return GoalRunResult.builder(true, goal)
                .artifactId(artifactId)
                .stats(readStats(outputDir))
                .attempts(reflexion.getAttemptCount())
                .finalState(fsm.getCurrentState())
                .stateHistory(fsm.getStateHistory())
                .toolHistory(fsm.getToolHistory())
                .outputDir(outputDir.toString())
                .response(response)
                .build();
    }

    private GoalRunResult exhausted(String goal,
                                    GoalGuardStateMachine fsm,
                                    ReflexionLoop reflexion,
                                    Path outputDir,
                                    Gate gate,
                                    GateResult verdict,
                                    RepairPlan plan) {
        String summary = reflexion.generateFailureSummary(verdict);
        fsm.toErrorState();
        log.warn("========== GOAL FAILED ==========\n{}", summary);
        return failResult(goal, fsm, reflexion, outputDir,
                gate.getName() + " failed after " + reflexion.getAttemptCount() + " repair attempt(s)",
                plan, summary);
    }

    private GoalRunResult abort(String goal,
                                GoalGuardStateMachine fsm,
                                ReflexionLoop reflexion,
                                Path outputDir,
                                String error) {
        log.error("[Orchestrator] {}", error);
        fsm.toErrorState();
        return failResult(goal, fsm, reflexion, outputDir, error, null, null);
    }

    private GoalRunResult failResult(String goal,
                                     GoalGuardStateMachine fsm,
                                     ReflexionLoop reflexion,
                                     Path outputDir,
                                     String error,
                                     RepairPlan plan,
                                     String summary) {
        return GoalRunResult.builder(false, goal)
                .error(error)
                .repairPlan(plan)
                .failureSummary(summary)
                .attempts(reflexion.getAttemptCount())
                .finalState(fsm.getCurrentState())
                .stateHistory(fsm.getStateHistory())
                .toolHistory(fsm.getToolHistory())
                .outputDir(outputDir != null ? outputDir.toString() : null)
                .build();
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private JsonNode readStats(Path outputDir) {
        Path statsPath = outputDir.resolve(ProductGate.STATS_FILE);
        if (!Files.exists(statsPath)) {
            return null;
        }
        try {
            return mapper.readTree(statsPath.toFile());
        } catch (IOException e) {
            log.warn("[Orchestrator] Could not read {}: {}", statsPath, e.getMessage());
            return null;
        }
    }

    private Path createRunDirectory(String goal) throws IOException {
        String base = LocalDateTime.now().format(RUN_DIR_FORMAT) + "-" + slug(goal);
        Path dir = outputRoot.resolve(base);
        int suffix = 2;
        while (Files.exists(dir)) {
            dir = outputRoot.resolve(base + "-" + suffix++);
        }
        Files.createDirectories(dir);
        log.info("[Orchestrator] Output directory: {}", dir.toAbsolutePath());
        return dir.toAbsolutePath();
    }

    static String slug(String goal) {
        String slug = goal.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? "goal" : slug;
    }
}
