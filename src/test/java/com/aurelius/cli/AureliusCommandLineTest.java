package com.aurelius.cli;

import com.aurelius.config.ToolBinaryLocator;
import com.aurelius.core.tool.ArtifactIds;
import com.aurelius.core.tool.ScriptedToolContract;
import com.aurelius.core.tool.StubToolContract;
import com.aurelius.core.tool.ToolCall;
import com.aurelius.core.tool.ToolResult;
import com.aurelius.core.tool.ToolType;
import com.aurelius.orchestrator.GoalOrchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class AureliusCommandLineTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private ScriptedToolContract tools;
    private Path dataFile;

    @BeforeEach
    void setUp() throws Exception {
        tools = new ScriptedToolContract(new StubToolContract(mapper));
        dataFile = Files.writeString(tempDir.resolve("prices.csv"), "timestamp,close\n");
    }

    private AureliusCommandLine commandLine(ToolBinaryLocator locator) {
        GoalOrchestrator orchestrator = new GoalOrchestrator(
                (engine, memory) -> tools, mapper, tempDir.resolve("runs").toString(), 1, 0.25, true);
        return new AureliusCommandLine(orchestrator, locator,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private AureliusCommandLine commandLine() {
        return commandLine(new ToolBinaryLocator("", "quant_engine", "", "hipcortex", ""));
    }

    private static String[] append(String[] args, String extra) {
        String[] all = Arrays.copyOf(args, args.length + 1);
        all[args.length] = extra;
        return all;
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testNoCommandPrintsUsage() {
        assertEquals(AureliusCommandLine.EXIT_USAGE, commandLine().execute(new String[0]));
        assertTrue(output().contains("Usage:"));
    }

    @Test
    void testUnknownCommand() {
        assertEquals(AureliusCommandLine.EXIT_USAGE, commandLine().execute(new String[] { "deploy" }));
        assertTrue(output().contains("Unknown command: deploy"));
    }

    @Test
    void testRunRequiresGoalAndData() {
        assertEquals(AureliusCommandLine.EXIT_USAGE,
                commandLine().execute(new String[] { "run", "--goal", "trend" }));
        assertTrue(output().contains("run requires --goal and --data"));
    }

    @Test
    void testRunRejectsMissingDataFile() {
        int code = commandLine().execute(new String[] {
                "run", "--goal", "trend", "--data", tempDir.resolve("nope.csv").toString() });

        assertEquals(AureliusCommandLine.EXIT_USAGE, code);
        assertTrue(output().contains("data path does not exist"));
    }

    @Test
    void testSuccessfulRunPrintsArtifactAndStats() {
        int code = commandLine().execute(new String[] {
                "run", "--goal", "trend under DD<10%", "--data", dataFile.toString(), "--no-strict" });

        assertEquals(AureliusCommandLine.EXIT_OK, code, output());
        assertTrue(output().contains("✓ Goal completed successfully!"));
        assertTrue(output().contains("Artifact ID: "));
        assertTrue(output().contains("Total Return: 12.00%"));
        assertTrue(output().contains("Max Drawdown: 6.00%"));
    }

    @Test
    void testStrictRunPrintsOnlyArtifactResponse() {
        int code = commandLine().execute(new String[] {
                "run", "--goal", "trend", "--data", dataFile.toString(), "--strict" });

        assertEquals(AureliusCommandLine.EXIT_OK, code, output());
        assertEquals("Committed\nArtifacts:\n  " + ArtifactIds.sha256("trend"), output().strip());
        assertFalse(output().contains("Total Return"));
    }

    @Test
    void testStrictAndNonStrictOutputsDiffer() {
        String[] base = { "run", "--goal", "trend", "--data", dataFile.toString() };

        commandLine().execute(base);
        String strictOutput = output();
        buffer.reset();
        commandLine().execute(append(base, "--no-strict"));
        String relaxedOutput = output();

        assertNotEquals(strictOutput, relaxedOutput);
        assertTrue(strictOutput.contains("Artifacts:"));
        assertTrue(relaxedOutput.contains("✓ Goal completed successfully!"));
    }

    @Test
    void testStrictRunWithholdsMalformedArtifactId() {
        tools.enqueue(ToolType.MEMORY_COMMIT,
                ToolResult.success(mapper.createObjectNode(), "not-a-hash"));

        int code = commandLine().execute(new String[] {
                "run", "--goal", "trend", "--data", dataFile.toString() });

        assertEquals(AureliusCommandLine.EXIT_OK, code, output());
        assertEquals("No artifacts", output().strip());
        assertFalse(output().contains("not-a-hash"));
    }

    @Test
    void testBooleanFlagWithValueIsUsageError() {
        int code = commandLine().execute(new String[] {
                "run", "--goal", "trend", "--data", dataFile.toString(), "--strict=false" });

        assertEquals(AureliusCommandLine.EXIT_USAGE, code);
        assertTrue(output().contains("--strict is a flag and takes no value"));
        assertTrue(tools.getCalls().isEmpty());
    }

    @Test
    void testCliDefaultDrawdownLimitIsPassedToCrv() {
        commandLine().execute(new String[] { "run", "--goal", "trend", "--data", dataFile.toString() });

        ToolCall crv = tools.getCalls().stream()
                .filter(c -> c.getToolType() == ToolType.CRV_VERIFY)
                .findFirst()
                .orElseThrow();
        assertEquals(String.valueOf(AureliusCommandLine.CLI_DEFAULT_MAX_DRAWDOWN), crv.getString("max_drawdown_limit"));
    }

    @Test
    void testFailedRunPrintsRepairPlan() {
        tools.whenCalled(ToolType.LINT, call -> ToolResult.failure("3 warnings"));

        int code = commandLine().execute(new String[] {
                "run", "--goal", "trend", "--data", dataFile.toString(), "--no-strict" });

        assertEquals(AureliusCommandLine.EXIT_FAILURE, code);
        assertTrue(output().contains("✗ Goal failed"));
        assertTrue(output().contains("Type: lint_failure"));
        assertTrue(output().contains("  - Fix lint warnings"));
    }

    @Test
    void testBadNumberIsUsageError() {
        int code = commandLine().execute(new String[] {
                "run", "--goal", "trend", "--data", dataFile.toString(), "--max-drawdown", "lots" });

        assertEquals(AureliusCommandLine.EXIT_USAGE, code);
    }

    @Test
    void testValidateFailsWithoutEngine() {
        ToolBinaryLocator locator = new ToolBinaryLocator(
                "", "aurelius-no-such-engine", "", "aurelius-no-such-memory", tempDir.toString());

        assertEquals(AureliusCommandLine.EXIT_FAILURE, commandLine(locator).execute(new String[] { "validate" }));
        assertTrue(output().contains("✗ Validation failed"));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void testValidateWithEngineOnly() throws Exception {
        Path engine = Files.writeString(tempDir.resolve("quant_engine"), "#!/bin/sh\n");
        assertTrue(engine.toFile().setExecutable(true));
        ToolBinaryLocator locator = new ToolBinaryLocator(
                "", "quant_engine", "", "aurelius-no-such-memory", tempDir.toString());

        assertEquals(AureliusCommandLine.EXIT_OK, commandLine(locator).execute(new String[] { "validate" }));
        assertTrue(output().contains("✓ Engine CLI found"));
        assertTrue(output().contains("✗ HipCortex CLI not found (optional)"));
    }
}
