package com.aurelius.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a backtest spec from a natural-language goal and writes it as
 * strategy_spec.json. This is the in-process half of generate_strategy;
 * the engine only ever sees the written file.
 */
public class StrategySpecWriter {

    private static final Logger log = LoggerFactory.getLogger(StrategySpecWriter.class);

    public static final String SPEC_FILE_NAME = "strategy_spec.json";

    static final long DEFAULT_SEED = 42L;
    static final double DEFAULT_INITIAL_CASH = 100_000.0;
    static final int DEFAULT_LOOKBACK = 20;
    static final double DEFAULT_VOL_TARGET = 0.15;
    static final String DEFAULT_SYMBOL = "SPY";

    // "DD<10%", "drawdown < 8%"
    private static final Pattern DRAWDOWN_HINT =
            Pattern.compile("(?:dd|drawdown)\\s*<\\s*(\\d+(?:\\.\\d+)?)\\s*%");

    private final ObjectMapper mapper;

    public StrategySpecWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param goal       goal text
     * @param symbol     instrument, or null for the default
     * @param outputDir  directory to write into (created if missing)
     * @return written spec location plus its content hash
     */
    public WrittenSpec write(String goal, String symbol, Path outputDir) throws IOException {
        ObjectNode spec = buildSpec(goal, symbol);

        Files.createDirectories(outputDir);
        Path specPath = outputDir.resolve(SPEC_FILE_NAME);
        byte[] bytes = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(spec);
        Files.write(specPath, bytes);

        String artifactId = ArtifactIds.sha256(bytes);
        log.info("[StrategySpec] Wrote {} ({} bytes, artifact {})", specPath, bytes.length, artifactId);
        return new WrittenSpec(specPath, spec, artifactId);
    }

    ObjectNode buildSpec(String goal, String symbol) {
        String lower = goal != null ? goal.toLowerCase(Locale.ROOT) : "";

        ObjectNode strategy = mapper.createObjectNode();
        strategy.put("type", lower.contains("reversion") ? "mean_reversion" : "ts_momentum");
        strategy.put("symbol", symbol != null && !symbol.isBlank() ? symbol : DEFAULT_SYMBOL);
        strategy.put("lookback", DEFAULT_LOOKBACK);
        strategy.put("vol_target", volTargetFor(lower));
        strategy.put("vol_lookback", DEFAULT_LOOKBACK);

        ObjectNode costModel = mapper.createObjectNode();
        costModel.put("type", "fixed_per_share");
        costModel.put("cost_per_share", 0.005);
        costModel.put("minimum_commission", 1.0);

        ObjectNode spec = mapper.createObjectNode();
        spec.put("goal", goal);
        spec.put("initial_cash", DEFAULT_INITIAL_CASH);
        spec.put("seed", DEFAULT_SEED);
        spec.set("strategy", strategy);
        spec.set("cost_model", costModel);
        return spec;
    }

    /**
     * A drawdown ceiling in the goal caps the volatility target at the same
     * fraction; otherwise the default target applies.
     */
    private static double volTargetFor(String lowerGoal) {
        Matcher m = DRAWDOWN_HINT.matcher(lowerGoal);
        if (m.find()) {
            double ceiling = Double.parseDouble(m.group(1)) / 100.0;
            if (ceiling > 0.0 && ceiling < DEFAULT_VOL_TARGET) {
                return ceiling;
            }
        }
        return DEFAULT_VOL_TARGET;
    }

    public static final class WrittenSpec {
        private final Path path;
        private final ObjectNode spec;
        private final String artifactId;

        WrittenSpec(Path path, ObjectNode spec, String artifactId) {
            this.path = path;
            this.spec = spec;
            this.artifactId = artifactId;
        }

        public Path getPath()        { return path; }
        public ObjectNode getSpec()  { return spec; }
        public String getArtifactId() { return artifactId; }
    }
}
