package com.aurelius.core.fsm;

import com.aurelius.core.tool.ToolType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * FsmState: current phase plus the append-only path taken to reach it.
 *
 * Owned by exactly one goal run; never shared, merged or forked.
 * Tool-triggered moves append to both logs. Forced moves (gate verdicts,
 * reflexion, error) append to the state log only.
 */
public class FsmState {

    private State currentState;
    private final List<State> history;
    private final List<ToolType> toolHistory;

    public FsmState() {
        this.currentState = State.INIT;
        this.history      = new ArrayList<>();
        this.toolHistory  = new ArrayList<>();
    }

    public State getCurrentState() { return currentState; }

    void advance(State next, ToolType cause) {
        history.add(currentState);
        toolHistory.add(cause);
        currentState = next;
    }

    void force(State next) {
        history.add(currentState);
        currentState = next;
    }

    public List<State> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public List<ToolType> getToolHistory() {
        return Collections.unmodifiableList(new ArrayList<>(toolHistory));
    }
}
