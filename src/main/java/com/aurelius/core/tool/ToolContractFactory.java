package com.aurelius.core.tool;

/**
 * Creates the Tool Contract for one goal run.
 *
 * Binary overrides come from the command line and apply to that run only.
 */
public interface ToolContractFactory {

    ToolContract create(String engineCliOverride, String memoryCliOverride);
}
