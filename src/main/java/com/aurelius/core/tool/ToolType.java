package com.aurelius.core.tool;

/**
 * Closed set of action kinds the control plane may invoke.
 *
 * Each type is served by exactly one external binary:
 *   ENGINE - strategy generation, backtests, tests, determinism, lint, CRV
 *   MEMORY - commit store (search / commit / show)
 */
public enum ToolType {
    GENERATE_STRATEGY("generate_strategy", Backend.ENGINE),
    BACKTEST("backtest", Backend.ENGINE),
    RUN_TESTS("run_tests", Backend.ENGINE),
    CHECK_DETERMINISM("check_determinism", Backend.ENGINE),
    LINT("lint", Backend.ENGINE),
    CRV_VERIFY("crv_verify", Backend.ENGINE),
    MEMORY_SEARCH("hipcortex_search", Backend.MEMORY),
    MEMORY_COMMIT("hipcortex_commit", Backend.MEMORY),
    MEMORY_SHOW("hipcortex_show", Backend.MEMORY);

    public enum Backend {
        ENGINE,
        MEMORY
    }

    private final String wireName;
    private final Backend backend;

    ToolType(String wireName, Backend backend) {
        this.wireName = wireName;
        this.backend = backend;
    }

    public String getWireName() {
        return wireName;
    }

    public Backend getBackend() {
        return backend;
    }
}
