package com.aurelius.config;

import com.aurelius.core.tool.ToolType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Resolves the engine and memory-store binaries.
 *
 * Resolution order:
 *   1. per-run override path (CLI flag)
 *   2. configured path (aurelius.engine.cli / aurelius.memory.cli)
 *   3. binary name inside each configured search dir
 *   4. binary name on PATH
 */
@Component
public class ToolBinaryLocator {

    private static final Logger log = LoggerFactory.getLogger(ToolBinaryLocator.class);

    private final String engineCli;
    private final String engineBinaryName;
    private final String memoryCli;
    private final String memoryBinaryName;
    private final List<Path> searchDirs;

    public ToolBinaryLocator(
            @Value("${aurelius.engine.cli:}") String engineCli,
            @Value("${aurelius.engine.binary-name:quant_engine}") String engineBinaryName,
            @Value("${aurelius.memory.cli:}") String memoryCli,
            @Value("${aurelius.memory.binary-name:hipcortex}") String memoryBinaryName,
            @Value("${aurelius.binary.search-dirs:target/release,target/debug}") String searchDirs
    ) {
        this.engineCli = engineCli;
        this.engineBinaryName = engineBinaryName;
        this.memoryCli = memoryCli;
        this.memoryBinaryName = memoryBinaryName;
        this.searchDirs = parseDirs(searchDirs);
    }

    public Path locate(ToolType.Backend backend) throws BinaryNotFoundException {
        return locate(backend, null);
    }

    public Path locate(ToolType.Backend backend, String overridePath) throws BinaryNotFoundException {
        String configured = backend == ToolType.Backend.ENGINE ? engineCli : memoryCli;
        String binaryName = backend == ToolType.Backend.ENGINE ? engineBinaryName : memoryBinaryName;

        for (String explicit : new String[] { overridePath, configured }) {
            if (explicit == null || explicit.isBlank()) {
                continue;
            }
            Path path = Path.of(explicit);
            if (isExecutable(path)) {
                return path.toAbsolutePath();
            }
            throw new BinaryNotFoundException(
                    backend + " binary not executable at " + path.toAbsolutePath());
        }

        List<Path> candidates = new ArrayList<>();
        for (Path dir : searchDirs) {
            candidates.add(dir.resolve(binaryName));
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv != null) {
            for (String dir : pathEnv.split(File.pathSeparator)) {
                if (!dir.isBlank()) {
                    candidates.add(Path.of(dir).resolve(binaryName));
                }
            }
        }

        for (Path candidate : candidates) {
            if (isExecutable(candidate)) {
                log.debug("[BinaryLocator] {} resolved to {}", backend, candidate);
                return candidate.toAbsolutePath();
            }
        }

        throw new BinaryNotFoundException(
                backend + " binary '" + binaryName + "' not found in " + searchDirs + " or PATH");
    }

    private static boolean isExecutable(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }

    private static List<Path> parseDirs(String raw) {
        List<Path> dirs = new ArrayList<>();
        if (raw == null) {
            return dirs;
        }
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(s -> dirs.add(Path.of(s)));
        return dirs;
    }

    public static class BinaryNotFoundException extends Exception {
        public BinaryNotFoundException(String message) {
            super(message);
        }
    }
}
