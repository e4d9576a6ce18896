package com.aurelius.core.fsm;

import com.aurelius.core.tool.ToolType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * GoalGuardStateMachine: rejects tool invocations that are illegal in the
 * current pipeline phase and records the path taken.
 *
 * Illegal requests are answered with {@code false}; nothing here throws for
 * an out-of-order tool. Callers must check the return value of
 * {@link #transition(ToolType)} before assuming the machine advanced.
 *
 * One instance per goal run. Not thread-safe.
 */
public class GoalGuardStateMachine {

    private static final Logger log = LoggerFactory.getLogger(GoalGuardStateMachine.class);

    private final TransitionTable table;
    private FsmState state;

    public GoalGuardStateMachine() {
        this(TransitionTable.standard());
    }

    public GoalGuardStateMachine(TransitionTable table) {
        this.table = table;
        this.state = new FsmState();
    }

    public boolean canExecute(ToolType tool) {
        return table.allows(state.getCurrentState(), tool);
    }

    /**
     * Advance on a tool invocation.
     *
     * @return true if the pair was in the table and the machine moved;
     *         false (state untouched) otherwise
     */
    public boolean transition(ToolType tool) {
        State from = state.getCurrentState();
        State to = table.target(from, tool);

        if (to == null) {
            log.warn("[GoalGuard] Rejected {} in state {} (allowed: {})",
                    tool.getWireName(), from, allowedTools());
            return false;
        }

        state.advance(to, tool);
        log.info("[GoalGuard] {} --{}--> {}", from, tool.getWireName(), to);
        return true;
    }

    /**
     * Move unconditionally. Reserved for externally-decided verdicts
     * (gate passed, reflexion, error) that are not single tool calls.
     */
    public void forceTransition(State next) {
        State from = state.getCurrentState();
        state.force(next);
        log.info("[GoalGuard] {} ==forced==> {}", from, next);
    }

    public Set<ToolType> allowedTools() {
        Set<ToolType> allowed = table.allowedTools(state.getCurrentState());
        return allowed.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(allowed));
    }

    public void toReflexionState() {
        forceTransition(State.REFLEXION);
    }

    public void toErrorState() {
        forceTransition(State.ERROR);
    }

    public void reset() {
        state = new FsmState();
        log.info("[GoalGuard] Reset to {}", State.INIT);
    }

    public State getCurrentState() {
        return state.getCurrentState();
    }

    public List<State> getStateHistory() {
        return state.getHistory();
    }

    public List<ToolType> getToolHistory() {
        return state.getToolHistory();
    }

    public TransitionTable getTable() {
        return table;
    }
}
