package com.aurelius.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single request to an external tool.
 *
 * Parameters are tool-specific and kept in insertion order so the
 * process wrapper renders command-line flags deterministically.
 */
public class ToolCall {

    private final ToolType toolType;
    private final Map<String, Object> parameters;

    public ToolCall(ToolType toolType, Map<String, Object> parameters) {
        if (toolType == null) {
            throw new IllegalArgumentException("toolType must not be null");
        }
        this.toolType = toolType;
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Collections.emptyMap();
    }

    public static ToolCall of(ToolType toolType) {
        return new ToolCall(toolType, null);
    }

    public ToolType getToolType() {
        return toolType;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    /**
     * String view of a parameter, or null when absent.
     */
    public String getString(String name) {
        Object value = parameters.get(name);
        return value != null ? String.valueOf(value) : null;
    }

    @Override
    public String toString() {
        return "ToolCall{tool=" + toolType.getWireName() + ", parameters=" + parameters.keySet() + "}";
    }
}
