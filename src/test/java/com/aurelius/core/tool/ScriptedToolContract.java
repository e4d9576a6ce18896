package com.aurelius.core.tool;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Test double: returns queued results per tool type, falling back to a
 * per-type default, then to the fallback contract (or plain success), and
 * records every call.
 */
public class ScriptedToolContract implements ToolContract {

    private final Map<ToolType, Deque<ToolResult>> queued = new EnumMap<>(ToolType.class);
    private final Map<ToolType, Function<ToolCall, ToolResult>> defaults = new EnumMap<>(ToolType.class);
    private final List<ToolCall> calls = new ArrayList<>();
    private final ToolContract fallback;

    public ScriptedToolContract() {
        this(null);
    }

    public ScriptedToolContract(ToolContract fallback) {
        this.fallback = fallback;
    }

    public ScriptedToolContract enqueue(ToolType type, ToolResult... results) {
        Deque<ToolResult> queue = queued.computeIfAbsent(type, t -> new ArrayDeque<>());
        for (ToolResult r : results) {
            queue.addLast(r);
        }
        return this;
    }

    public ScriptedToolContract whenCalled(ToolType type, Function<ToolCall, ToolResult> responder) {
        defaults.put(type, responder);
        return this;
    }

    @Override
    public ToolResult invoke(ToolCall call) {
        calls.add(call);
        Deque<ToolResult> queue = queued.get(call.getToolType());
        if (queue != null && !queue.isEmpty()) {
            return queue.removeFirst();
        }
        Function<ToolCall, ToolResult> responder = defaults.get(call.getToolType());
        if (responder != null) {
            return responder.apply(call);
        }
        if (fallback != null) {
            return fallback.invoke(call);
        }
        return ToolResult.success(JsonNodeFactory.instance.objectNode());
    }

    public List<ToolCall> getCalls() {
        return calls;
    }

    public long count(ToolType type) {
        return calls.stream().filter(c -> c.getToolType() == type).count();
    }

    public List<ToolType> callOrder() {
        List<ToolType> order = new ArrayList<>();
        calls.forEach(c -> order.add(c.getToolType()));
        return order;
    }
}
