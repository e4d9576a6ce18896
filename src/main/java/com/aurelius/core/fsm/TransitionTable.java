package com.aurelius.core.fsm;

import com.aurelius.core.tool.ToolType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable (State, ToolType) → State map.
 *
 * DEV_GATE and PRODUCT_GATE only have self-loops: several checks run inside
 * one gate phase, and the gate verdict (not a tool call) moves the machine
 * on via a forced transition. ERROR has no outgoing tool transitions.
 */
public final class TransitionTable {

    private static final TransitionTable STANDARD = buildStandard();

    private final Map<State, Map<ToolType, State>> rows;

    private TransitionTable(Map<State, Map<ToolType, State>> rows) {
        Map<State, Map<ToolType, State>> copy = new EnumMap<>(State.class);
        for (State state : State.values()) {
            Map<ToolType, State> row = rows.get(state);
            copy.put(state, row == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new EnumMap<>(row)));
        }
        this.rows = Collections.unmodifiableMap(copy);
    }

    /**
     * The goal pipeline table. Built once and shared; it is immutable.
     */
    public static TransitionTable standard() {
        return STANDARD;
    }

    public static TransitionTable of(List<Transition> transitions) {
        Map<State, Map<ToolType, State>> rows = new EnumMap<>(State.class);
        for (Transition t : transitions) {
            Map<ToolType, State> row = rows.computeIfAbsent(t.getFrom(), s -> new EnumMap<>(ToolType.class));
            State previous = row.put(t.getTool(), t.getTo());
            if (previous != null && previous != t.getTo()) {
                throw new IllegalArgumentException("Conflicting transitions for "
                        + t.getFrom() + " on " + t.getTool() + ": " + previous + " and " + t.getTo());
            }
        }
        return new TransitionTable(rows);
    }

    /**
     * @return target state, or null when the pair is not in the table
     */
    public State target(State from, ToolType tool) {
        return rows.get(from).get(tool);
    }

    public boolean allows(State from, ToolType tool) {
        return rows.get(from).containsKey(tool);
    }

    public Set<ToolType> allowedTools(State from) {
        return rows.get(from).keySet();
    }

    public List<Transition> transitions() {
        List<Transition> all = new ArrayList<>();
        rows.forEach((from, row) -> row.forEach((tool, to) -> all.add(new Transition(from, tool, to))));
        return Collections.unmodifiableList(all);
    }

    private static TransitionTable buildStandard() {
        List<Transition> t = new ArrayList<>();

        t.add(new Transition(State.INIT, ToolType.GENERATE_STRATEGY, State.STRATEGY_DESIGN));
        t.add(new Transition(State.INIT, ToolType.MEMORY_SEARCH, State.INIT));

        t.add(new Transition(State.STRATEGY_DESIGN, ToolType.GENERATE_STRATEGY, State.STRATEGY_DESIGN));
        t.add(new Transition(State.STRATEGY_DESIGN, ToolType.BACKTEST, State.BACKTEST_COMPLETE));
        t.add(new Transition(State.STRATEGY_DESIGN, ToolType.MEMORY_SEARCH, State.STRATEGY_DESIGN));

        t.add(new Transition(State.BACKTEST_READY, ToolType.BACKTEST, State.BACKTEST_COMPLETE));

        t.add(new Transition(State.BACKTEST_COMPLETE, ToolType.RUN_TESTS, State.DEV_GATE));
        t.add(new Transition(State.BACKTEST_COMPLETE, ToolType.BACKTEST, State.BACKTEST_COMPLETE));

        t.add(new Transition(State.DEV_GATE, ToolType.CHECK_DETERMINISM, State.DEV_GATE));
        t.add(new Transition(State.DEV_GATE, ToolType.LINT, State.DEV_GATE));
        t.add(new Transition(State.DEV_GATE, ToolType.RUN_TESTS, State.DEV_GATE));

        t.add(new Transition(State.DEV_GATE_PASSED, ToolType.CRV_VERIFY, State.PRODUCT_GATE));

        t.add(new Transition(State.PRODUCT_GATE, ToolType.CRV_VERIFY, State.PRODUCT_GATE));

        t.add(new Transition(State.PRODUCT_GATE_PASSED, ToolType.MEMORY_COMMIT, State.COMMITTED));

        t.add(new Transition(State.COMMITTED, ToolType.MEMORY_SHOW, State.COMMITTED));
        t.add(new Transition(State.COMMITTED, ToolType.MEMORY_SEARCH, State.COMMITTED));

        t.add(new Transition(State.REFLEXION, ToolType.GENERATE_STRATEGY, State.STRATEGY_DESIGN));
        t.add(new Transition(State.REFLEXION, ToolType.BACKTEST, State.BACKTEST_COMPLETE));
        t.add(new Transition(State.REFLEXION, ToolType.RUN_TESTS, State.DEV_GATE));

        return of(t);
    }
}
