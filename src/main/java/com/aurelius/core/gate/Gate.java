package com.aurelius.core.gate;

import java.util.Map;

/**
 * A named battery of checks that must all pass before the pipeline moves
 * past a phase.
 *
 * Implementations hold no per-run mutable state; one instance can be
 * shared across goal runs.
 */
public interface Gate {

    String CONTEXT_SPEC_PATH  = "spec_path";
    String CONTEXT_DATA_PATH  = "data_path";
    String CONTEXT_OUTPUT_DIR = "output_dir";

    GateResult run(Map<String, Object> context);

    String getName();
}
