package com.aurelius.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * In-memory stand-in for the engine and memory store.
 *
 * Every call succeeds. A backtest writes a small, constraint-satisfying
 * result set into its output_dir so the product gate has real files to
 * look at.
 */
public class StubToolContract implements ToolContract {

    private final ObjectMapper mapper;
    private final StrategySpecWriter specWriter;

    public StubToolContract(ObjectMapper mapper) {
        this.mapper = mapper;
        this.specWriter = new StrategySpecWriter(mapper);
    }

    @Override
    public ToolResult invoke(ToolCall call) {
        try {
            return switch (call.getToolType()) {
                case GENERATE_STRATEGY -> generateStrategy(call);
                case BACKTEST -> backtest(call);
                case RUN_TESTS -> ToolResult.success(text("3 passed, 0 failed"));
                case CHECK_DETERMINISM -> ToolResult.success(mapper.createObjectNode().put("deterministic", true));
                case LINT -> ToolResult.success(text("0 warnings"));
                case CRV_VERIFY -> ToolResult.success(crvOutput());
                case MEMORY_COMMIT -> commit(call);
                case MEMORY_SEARCH, MEMORY_SHOW -> ToolResult.success(mapper.createObjectNode());
            };
        } catch (IOException e) {
            return ToolResult.failure("Stub execution failed: " + e.getMessage());
        }
    }

    private ToolResult generateStrategy(ToolCall call) throws IOException {
        StrategySpecWriter.WrittenSpec written = specWriter.write(
                call.getString("goal"), call.getString("symbol"), Path.of(call.getString("output_dir")));
        ObjectNode output = mapper.createObjectNode();
        output.put("spec_path", written.getPath().toString());
        return ToolResult.success(output, written.getArtifactId());
    }

    private ToolResult backtest(ToolCall call) throws IOException {
        Path outputDir = Path.of(call.getString("output_dir"));
        Files.createDirectories(outputDir);

        ObjectNode stats = mapper.createObjectNode();
        stats.put("total_return", 0.12);
        stats.put("sharpe_ratio", 1.4);
        stats.put("max_drawdown", 0.06);
        byte[] statsBytes = mapper.writeValueAsBytes(stats);

        Files.write(outputDir.resolve("stats.json"), statsBytes);
        Files.writeString(outputDir.resolve("trades.csv"),
                "timestamp,symbol,side,quantity,price\n", StandardCharsets.UTF_8);
        Files.writeString(outputDir.resolve("equity_curve.csv"),
                "timestamp,equity\n0,100000.0\n", StandardCharsets.UTF_8);
        Files.write(outputDir.resolve("crv_report.json"), mapper.writeValueAsBytes(crvReport()));

        return ToolResult.success(stats, ArtifactIds.sha256(statsBytes));
    }

    private ToolResult commit(ToolCall call) {
        String message = call.getString("message");
        ObjectNode output = mapper.createObjectNode();
        output.put("committed", true);
        return ToolResult.success(output, ArtifactIds.sha256(message != null ? message : "commit"));
    }

    private ObjectNode crvOutput() {
        ObjectNode output = mapper.createObjectNode();
        output.set("crv_report", crvReport());
        return output;
    }

    private ObjectNode crvReport() {
        ObjectNode report = mapper.createObjectNode();
        report.put("passed", true);
        report.putArray("violations");
        return report;
    }

    private ObjectNode text(String stdout) {
        return mapper.createObjectNode().put("stdout", stdout);
    }
}
