package com.aurelius.core.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external binary to completion and captures its output.
 *
 * stdout and stderr are drained on separate threads: the engine writes its
 * JSON result to stdout and diagnostics to stderr, and the two must not be
 * interleaved.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private static final long STREAM_JOIN_MILLIS = 1000;

    private final long timeoutSeconds;

    public ProcessRunner(@Value("${aurelius.tool.timeout-seconds:300}") long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
        log.info("[ProcessRunner] Timeout: {}s", timeoutSeconds);
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public ProcessExecutionResult run(List<String> command, Path workingDirectory) {

        long startTime = System.currentTimeMillis();
        log.info("[ProcessRunner] Executing: {}", String.join(" ", command));

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            if (workingDirectory != null) {
                builder.directory(workingDirectory.toFile());
            }
            process = builder.start();
        } catch (IOException e) {
            log.error("[ProcessRunner] Failed to launch {}: {}", command.get(0), e.getMessage());
            return ProcessExecutionResult.launchFailure(
                    "Failed to launch " + command.get(0) + ": " + e.getMessage(),
                    System.currentTimeMillis() - startTime);
        }

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread outThread = drain(process.getInputStream(), stdout, "stdout");
        Thread errThread = drain(process.getErrorStream(), stderr, "stderr");

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                log.warn("[ProcessRunner] Process timed out after {} seconds", timeoutSeconds);
                return new ProcessExecutionResult(
                        ProcessExecutionResult.EXIT_TIMEOUT,
                        snapshot(stdout),
                        "TIMEOUT after " + timeoutSeconds + " seconds",
                        System.currentTimeMillis() - startTime
                );
            }

            outThread.join(STREAM_JOIN_MILLIS);
            errThread.join(STREAM_JOIN_MILLIS);

        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            log.warn("[ProcessRunner] Interrupted while waiting for {}", command.get(0));
            return ProcessExecutionResult.launchFailure(
                    "Interrupted while waiting for " + command.get(0),
                    System.currentTimeMillis() - startTime);
        }

        int exitCode = process.exitValue();
        ProcessExecutionResult result = new ProcessExecutionResult(
                exitCode,
                snapshot(stdout),
                snapshot(stderr),
                System.currentTimeMillis() - startTime
        );
        log.info("[ProcessRunner] {}", result);
        return result;
    }

    private Thread drain(InputStream stream, StringBuilder sink, String name) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader =
                         new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append("\n");
                    }
                }
            } catch (IOException e) {
                log.warn("[ProcessRunner] Error reading {}: {}", name, e.getMessage());
            }
        }, "process-" + name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static String snapshot(StringBuilder sink) {
        synchronized (sink) {
            return sink.toString();
        }
    }
}
