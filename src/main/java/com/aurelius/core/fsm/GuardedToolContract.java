package com.aurelius.core.fsm;

import com.aurelius.core.tool.ToolCall;
import com.aurelius.core.tool.ToolContract;
import com.aurelius.core.tool.ToolResult;

/**
 * Tool Contract decorator that only lets through calls the state machine
 * allows, and advances the machine for each one it lets through.
 *
 * A rejected call is answered with a failed ToolResult; the delegate is
 * never invoked for it.
 */
public class GuardedToolContract implements ToolContract {

    private final ToolContract delegate;
    private final GoalGuardStateMachine fsm;

    public GuardedToolContract(ToolContract delegate, GoalGuardStateMachine fsm) {
        this.delegate = delegate;
        this.fsm = fsm;
    }

    @Override
    public ToolResult invoke(ToolCall call) {
        State before = fsm.getCurrentState();
        if (!fsm.transition(call.getToolType())) {
            return ToolResult.failure(
                    call.getToolType().getWireName() + " not allowed in state " + before.getWireName());
        }
        return delegate.invoke(call);
    }
}
