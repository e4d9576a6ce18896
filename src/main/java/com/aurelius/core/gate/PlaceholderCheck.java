package com.aurelius.core.gate;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;

/**
 * Always-passing check occupying a product-gate slot that has no real
 * implementation yet (walk-forward validation, stress suite).
 */
public class PlaceholderCheck implements ProductCheck {

    public static final String NOTE = "Placeholder - not implemented yet";

    private final String name;

    public PlaceholderCheck(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Outcome evaluate(Path outputDir) {
        ObjectNode detail = JsonNodeFactory.instance.objectNode();
        detail.put("note", NOTE);
        return Outcome.pass(detail);
    }
}
