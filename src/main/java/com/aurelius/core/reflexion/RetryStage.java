package com.aurelius.core.reflexion;

import com.aurelius.core.fsm.State;

/**
 * Where a repair attempt re-enters the pipeline, and the state the goal
 * guard is forced into before re-entry.
 */
public enum RetryStage {
    INIT("init", State.INIT),
    BACKTEST("backtest", State.BACKTEST_READY),
    DEV_GATE("dev_gate", State.DEV_GATE);

    private final String name;
    private final State resumeState;

    RetryStage(String name, State resumeState) {
        this.name = name;
        this.resumeState = resumeState;
    }

    public String getName() {
        return name;
    }

    public State getResumeState() {
        return resumeState;
    }
}
