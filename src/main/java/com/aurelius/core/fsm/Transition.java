package com.aurelius.core.fsm;

import com.aurelius.core.tool.ToolType;

import java.util.Objects;

/**
 * One row of the transition table: invoking {@code tool} in {@code from}
 * moves the machine to {@code to}.
 */
public final class Transition {

    private final State from;
    private final ToolType tool;
    private final State to;

    public Transition(State from, ToolType tool, State to) {
        this.from = Objects.requireNonNull(from, "from");
        this.tool = Objects.requireNonNull(tool, "tool");
        this.to = Objects.requireNonNull(to, "to");
    }

    public State getFrom()    { return from; }
    public ToolType getTool() { return tool; }
    public State getTo()      { return to; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transition)) return false;
        Transition that = (Transition) o;
        return from == that.from && tool == that.tool && to == that.to;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, tool, to);
    }

    @Override
    public String toString() {
        return from + " --" + tool.getWireName() + "--> " + to;
    }
}
