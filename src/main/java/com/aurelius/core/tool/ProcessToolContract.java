package com.aurelius.core.tool;

import com.aurelius.config.ToolBinaryLocator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * ProcessToolContract - runs each ToolCall against the engine or the
 * memory-store binary.
 *
 * Features:
 * - Never throws and never returns null
 * - Missing parameters, missing binaries, launch errors and timeouts all
 *   become failed ToolResults
 * - stdout is decoded as JSON when possible
 */
public class ProcessToolContract implements ToolContract {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolContract.class);

    private static final int MAX_ERROR_CHARS = 2000;

    private final ProcessRunner runner;
    private final ToolBinaryLocator locator;
    private final StrategySpecWriter specWriter;
    private final ObjectMapper mapper;
    private final String engineOverride;
    private final String memoryOverride;

    public ProcessToolContract(ProcessRunner runner,
                               ToolBinaryLocator locator,
                               ObjectMapper mapper,
                               String engineOverride,
                               String memoryOverride) {
        this.runner = runner;
        this.locator = locator;
        this.mapper = mapper;
        this.specWriter = new StrategySpecWriter(mapper);
        this.engineOverride = engineOverride;
        this.memoryOverride = memoryOverride;
    }

    @Override
    public ToolResult invoke(ToolCall call) {
        ToolType tool = call.getToolType();
        log.info("[ToolContract] Invoking {}", tool.getWireName());

        try {
            if (tool == ToolType.GENERATE_STRATEGY) {
                return generateStrategy(call);
            }

            List<String> arguments = buildArguments(call);
            String override = tool.getBackend() == ToolType.Backend.ENGINE ? engineOverride : memoryOverride;
            Path binary = locator.locate(tool.getBackend(), override);

            List<String> command = new ArrayList<>();
            command.add(binary.toString());
            command.addAll(arguments);

            ProcessExecutionResult result = runner.run(command, null);
            return toToolResult(tool, result);

        } catch (IllegalArgumentException e) {
            log.error("[ToolContract] Invalid parameters for {}: {}", tool.getWireName(), e.getMessage());
            return ToolResult.failure(e.getMessage());
        } catch (ToolBinaryLocator.BinaryNotFoundException e) {
            log.error("[ToolContract] {}", e.getMessage());
            return ToolResult.failure(e.getMessage());
        } catch (Exception e) {
            log.error("[ToolContract] {} failed: {}", tool.getWireName(), e.getMessage(), e);
            return ToolResult.failure(tool.getWireName() + " failed: " + e.getMessage());
        }
    }

    /* ============================================================
       ARGUMENT RENDERING
       ============================================================ */

    List<String> buildArguments(ToolCall call) {
        return switch (call.getToolType()) {
            case BACKTEST -> List.of(
                    "backtest",
                    "--spec", require(call, "spec_path"),
                    "--data", require(call, "data_path"),
                    "--out", require(call, "output_dir"));
            case RUN_TESTS -> List.of("test");
            case CHECK_DETERMINISM -> List.of(
                    "determinism",
                    "--spec", require(call, "spec_path"),
                    "--data", require(call, "data_path"),
                    "--runs", optional(call, "runs", "3"));
            case LINT -> List.of("lint");
            case CRV_VERIFY -> List.of(
                    "crv-verify",
                    "--stats", require(call, "stats_path"),
                    "--trades", require(call, "trades_path"),
                    "--equity", require(call, "equity_path"),
                    "--max-drawdown", require(call, "max_drawdown_limit"));
            case MEMORY_SEARCH -> List.of("search", "--query", require(call, "query"));
            case MEMORY_COMMIT -> List.of(
                    "commit",
                    "--message", require(call, "message"),
                    "--artifact", require(call, "artifact_path"));
            case MEMORY_SHOW -> List.of("show", require(call, "artifact_id"));
            case GENERATE_STRATEGY -> throw new IllegalArgumentException(
                    "generate_strategy is served in-process");
        };
    }

    private static String require(ToolCall call, String name) {
        String value = call.getString(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(
                    "Missing required parameter '" + name + "' for " + call.getToolType().getWireName());
        }
        return value;
    }

    private static String optional(ToolCall call, String name, String defaultValue) {
        String value = call.getString(name);
        return (value == null || value.isBlank()) ? defaultValue : value;
    }

    /* ============================================================
       RESULT DECODING
       ============================================================ */

    ToolResult toToolResult(ToolType tool, ProcessExecutionResult result) {
        JsonNode output = decodeOutput(result.getStdout());

        if (!result.isSuccess()) {
            String error = !result.getStderr().isBlank() ? result.getStderr() : result.getStdout();
            String message = tool.getWireName() + " exited with " + result.getExitCode()
                    + (error.isBlank() ? "" : ": " + truncate(error.trim()));
            log.warn("[ToolContract] {}", message);
            return ToolResult.failure(message, output);
        }

        String artifactId = null;
        if (output != null && output.hasNonNull("artifact_id")) {
            String reported = output.get("artifact_id").asText();
            if (ArtifactIds.isArtifactId(reported)) {
                artifactId = reported;
            } else {
                log.warn("[ToolContract] {} reported malformed artifact_id '{}', hashing stdout instead",
                        tool.getWireName(), reported);
            }
        }
        if (artifactId == null && !result.getStdout().isBlank()) {
            artifactId = ArtifactIds.sha256(result.getStdout());
        }
        return ToolResult.success(output, artifactId);
    }

    JsonNode decodeOutput(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(stdout);
            if (node != null && node.isContainerNode()) {
                return node;
            }
        } catch (JsonProcessingException e) {
            log.debug("[ToolContract] stdout is not JSON: {}", e.getOriginalMessage());
        }
        ObjectNode wrapped = mapper.createObjectNode();
        wrapped.put("stdout", stdout);
        return wrapped;
    }

    private ToolResult generateStrategy(ToolCall call) throws IOException {
        String goal = require(call, "goal");
        Path outputDir = Path.of(require(call, "output_dir"));

        StrategySpecWriter.WrittenSpec written = specWriter.write(goal, call.getString("symbol"), outputDir);

        ObjectNode output = mapper.createObjectNode();
        output.put("spec_path", written.getPath().toString());
        output.set("spec", written.getSpec());
        return ToolResult.success(output, written.getArtifactId());
    }

    private static String truncate(String text) {
        return text.length() <= MAX_ERROR_CHARS ? text : text.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
