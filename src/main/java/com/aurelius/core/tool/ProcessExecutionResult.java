package com.aurelius.core.tool;

/**
 * ProcessExecutionResult - raw outcome of running one external binary.
 *
 * Fields:
 *   - exitCode: process exit code (0 success, -1 timeout, -2 launch failure)
 *   - stdout / stderr: captured streams
 *   - elapsedTimeMs: wall-clock time of the run
 */
public class ProcessExecutionResult {

    public static final int EXIT_TIMEOUT = -1;
    public static final int EXIT_LAUNCH_FAILURE = -2;

    private final int exitCode;
    private final String stdout;
    private final String stderr;
    private final long elapsedTimeMs;

    public ProcessExecutionResult(int exitCode, String stdout, String stderr, long elapsedTimeMs) {
        this.exitCode = exitCode;
        this.stdout = stdout != null ? stdout : "";
        this.stderr = stderr != null ? stderr : "";
        this.elapsedTimeMs = elapsedTimeMs;
    }

    public static ProcessExecutionResult launchFailure(String errorMessage, long elapsedTimeMs) {
        return new ProcessExecutionResult(EXIT_LAUNCH_FAILURE, "", errorMessage, elapsedTimeMs);
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public long getElapsedTimeMs() {
        return elapsedTimeMs;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public boolean isTimedOut() {
        return exitCode == EXIT_TIMEOUT;
    }

    @Override
    public String toString() {
        return String.format(
            "ProcessExecutionResult{exitCode=%d, stdoutLen=%d, stderrLen=%d, elapsedMs=%d}",
            exitCode,
            stdout.length(),
            stderr.length(),
            elapsedTimeMs
        );
    }
}
