package com.aurelius.core.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * ToolResult - outcome of a single tool invocation.
 *
 * A failed result always carries an error message. The artifact id,
 * when present, is a content-derived identifier (SHA-256 hex).
 */
public class ToolResult {

    private static final String UNSPECIFIED_ERROR = "Tool failed without an error message";

    private final boolean success;
    private final JsonNode output;
    private final String error;
    private final String artifactId;

    private ToolResult(boolean success, JsonNode output, String error, String artifactId) {
        this.success = success;
        this.output = output;
        this.error = error;
        this.artifactId = artifactId;
    }

    public static ToolResult success(JsonNode output) {
        return new ToolResult(true, output, null, null);
    }

    public static ToolResult success(JsonNode output, String artifactId) {
        return new ToolResult(true, output, null, artifactId);
    }

    public static ToolResult failure(String error) {
        return failure(error, null);
    }

    /**
     * Failed result that still carries whatever structured output the tool
     * produced (e.g. a CRV report listing violations).
     */
    public static ToolResult failure(String error, JsonNode output) {
        String message = (error == null || error.isBlank()) ? UNSPECIFIED_ERROR : error;
        return new ToolResult(false, output, message, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public JsonNode getOutput() {
        return output;
    }

    public boolean hasOutput() {
        return output != null && !output.isNull() && !output.isMissingNode();
    }

    public String getError() {
        return error;
    }

    public String getArtifactId() {
        return artifactId;
    }

    @Override
    public String toString() {
        if (success) {
            return artifactId != null
                    ? "ToolResult{Success, artifact=" + artifactId + "}"
                    : "ToolResult{Success}";
        }
        return "ToolResult{Error: " + error + "}";
    }
}
