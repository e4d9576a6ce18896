package com.aurelius.core.fsm;

/**
 * Pipeline phases of one goal run.
 *
 * INIT → STRATEGY_DESIGN → BACKTEST_COMPLETE → DEV_GATE → DEV_GATE_PASSED
 *      → PRODUCT_GATE → PRODUCT_GATE_PASSED → COMMITTED
 *
 * REFLEXION and ERROR sit outside the happy path: REFLEXION is entered after
 * a gate failure, ERROR once the retry budget is spent.
 */
public enum State {
    INIT("init"),
    STRATEGY_DESIGN("strategy_design"),
    BACKTEST_READY("backtest_ready"),
    BACKTEST_COMPLETE("backtest_complete"),
    DEV_GATE("dev_gate"),
    DEV_GATE_PASSED("dev_gate_passed"),
    PRODUCT_GATE("product_gate"),
    PRODUCT_GATE_PASSED("product_gate_passed"),
    REFLEXION("reflexion"),
    COMMITTED("committed"),
    ERROR("error");

    private final String wireName;

    State(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static State fromWireName(String wireName) {
        for (State state : values()) {
            if (state.wireName.equals(wireName)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown state: " + wireName);
    }
}
