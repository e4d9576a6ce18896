package com.aurelius.cli;

import com.aurelius.config.ToolBinaryLocator;
import com.aurelius.core.reflexion.RepairPlan;
import com.aurelius.core.tool.ToolType;
import com.aurelius.orchestrator.GoalOrchestrator;
import com.aurelius.orchestrator.dto.GoalRequest;
import com.aurelius.orchestrator.dto.GoalRunResult;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line surface.
 *
 *   run --goal <text> --data <path> [--max-drawdown <f>] [--strict|--no-strict]
 *       [--rust-cli <path>] [--hipcortex-cli <path>]
 *   validate
 *
 * With strict mode on (the default) a successful run prints only the
 * artifact response; --no-strict prints the banner and statistics.
 *
 * Exit codes: 0 success, 1 goal/validation failure, 2 usage error.
 */
@Component
@Profile("!test")
public class AureliusCommandLine implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(AureliusCommandLine.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final double CLI_DEFAULT_MAX_DRAWDOWN = 0.10;

    private static final Set<String> BOOLEAN_FLAGS = Set.of("strict", "no-strict", "help");

    private static final String RULE = "=".repeat(60);

    private static final String USAGE = String.join("\n",
            "Usage:",
            "  run --goal <text> --data <path> [--max-drawdown <float=0.10>] [--strict|--no-strict]",
            "      [--rust-cli <path>] [--hipcortex-cli <path>]",
            "  validate");

    private final GoalOrchestrator orchestrator;
    private final ToolBinaryLocator locator;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    public AureliusCommandLine(GoalOrchestrator orchestrator, ToolBinaryLocator locator) {
        this(orchestrator, locator, System.out);
    }

    AureliusCommandLine(GoalOrchestrator orchestrator, ToolBinaryLocator locator, PrintStream out) {
        this.orchestrator = orchestrator;
        this.locator = locator;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getSourceArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String[] args) {
        try {
            CommandLineOptions options = CommandLineOptions.parse(args, BOOLEAN_FLAGS);
            String command = options.getCommand();

            if (command == null || options.hasFlag("help")) {
                out.println(USAGE);
                return command == null ? EXIT_USAGE : EXIT_OK;
            }

            switch (command) {
                case "run":
                    return runGoal(options);
                case "validate":
                    return validate();
                default:
                    out.println("Unknown command: " + command);
                    out.println(USAGE);
                    return EXIT_USAGE;
            }
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        }
    }

    // =========================================================================
    // run
    // =========================================================================

    private int runGoal(CommandLineOptions options) {
        String goal = options.get("goal");
        String data = options.get("data");
        if (goal == null || data == null) {
            throw new IllegalArgumentException("run requires --goal and --data");
        }
        if (!Files.exists(Path.of(data))) {
            throw new IllegalArgumentException("data path does not exist: " + data);
        }

        Double maxDrawdown = options.getDouble("max-drawdown");
        boolean strict = !options.hasFlag("no-strict");

        GoalRequest request = new GoalRequest(
                goal,
                data,
                maxDrawdown != null ? maxDrawdown : CLI_DEFAULT_MAX_DRAWDOWN,
                strict,
                existingPath(options, "rust-cli"),
                existingPath(options, "hipcortex-cli"));

        GoalRunResult result = orchestrator.runGoal(request);
        log.info("[CLI] {}", result);

        if (result.isSuccess()) {
            if (strict) {
                out.println(result.getResponse());
            } else {
                printSuccess(result);
            }
            return EXIT_OK;
        }
        printFailure(result);
        return EXIT_FAILURE;
    }

    private void printSuccess(GoalRunResult result) {
        out.println();
        out.println(RULE);
        out.println("✓ Goal completed successfully!");
        out.println(RULE);

        if (result.getArtifactId() != null) {
            out.println();
            out.println("Artifact ID: " + result.getArtifactId());
        }

        JsonNode stats = result.getStats();
        if (stats != null) {
            out.println();
            out.println("Final Statistics:");
            out.println(String.format(Locale.ROOT, "  Total Return: %.2f%%", stats.path("total_return").asDouble(0) * 100));
            out.println(String.format(Locale.ROOT, "  Sharpe Ratio: %.2f", stats.path("sharpe_ratio").asDouble(0)));
            out.println(String.format(Locale.ROOT, "  Max Drawdown: %.2f%%", stats.path("max_drawdown").asDouble(0) * 100));
        }
    }

    private void printFailure(GoalRunResult result) {
        out.println();
        out.println(RULE);
        out.println("✗ Goal failed");
        out.println(RULE);

        if (result.getError() != null) {
            out.println();
            out.println("Error: " + result.getError());
        }

        RepairPlan plan = result.getRepairPlan();
        if (plan != null) {
            out.println();
            out.println("Repair plan generated:");
            out.println("  Type: " + plan.getFailureType().getCode());
            out.println("  Description: " + plan.getDescription());
            out.println();
            out.println("Suggested actions:");
            for (String action : plan.getActions()) {
                out.println("  - " + action);
            }
        }
    }

    private static String existingPath(CommandLineOptions options, String name) {
        String value = options.get(name);
        if (value != null && !Files.exists(Path.of(value))) {
            throw new IllegalArgumentException("--" + name + " path does not exist: " + value);
        }
        return value;
    }

    // =========================================================================
    // validate
    // =========================================================================

    private int validate() {
        out.println("Validating installation...");

        try {
            out.println("✓ Engine CLI found: " + locator.locate(ToolType.Backend.ENGINE));
        } catch (ToolBinaryLocator.BinaryNotFoundException e) {
            out.println();
            out.println("✗ Validation failed: " + e.getMessage());
            out.println();
            out.println("Please build the engine binaries:");
            out.println("  cargo build --release");
            return EXIT_FAILURE;
        }

        try {
            out.println("✓ HipCortex CLI found: " + locator.locate(ToolType.Backend.MEMORY));
        } catch (ToolBinaryLocator.BinaryNotFoundException e) {
            out.println("✗ HipCortex CLI not found (optional)");
        }

        out.println();
        out.println("✓ Installation valid");
        return EXIT_OK;
    }
}
