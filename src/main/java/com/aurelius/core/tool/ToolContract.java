package com.aurelius.core.tool;

/**
 * ToolContract - the only way the control plane touches the outside world.
 *
 * Implementations may block until the underlying process finishes.
 * They never throw: every failure is reported as a ToolResult with
 * success == false.
 */
public interface ToolContract {

    ToolResult invoke(ToolCall call);
}
