package com.aurelius.core.gate;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verdict of one gate run.
 *
 * {@code passed} is derived from the checks, never supplied: a result passes
 * iff every recorded check passed. Checks keep their execution order.
 */
public class GateResult {

    private final boolean passed;
    private final Map<String, Boolean> checks;
    private final List<String> errors;
    private final Map<String, JsonNode> details;

    public GateResult(Map<String, Boolean> checks, List<String> errors, Map<String, JsonNode> details) {
        this.checks = checks != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(checks))
                : Collections.emptyMap();
        this.errors = errors != null
                ? Collections.unmodifiableList(new ArrayList<>(errors))
                : Collections.emptyList();
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
        this.passed = this.checks.values().stream().allMatch(Boolean.TRUE::equals);
    }

    public boolean isPassed() {
        return passed;
    }

    public Map<String, Boolean> getChecks() {
        return checks;
    }

    /**
     * @return the check's outcome, or {@code defaultValue} when it was not recorded
     */
    public boolean check(String name, boolean defaultValue) {
        Boolean value = checks.get(name);
        return value != null ? value : defaultValue;
    }

    public List<String> getErrors() {
        return errors;
    }

    public Map<String, JsonNode> getDetails() {
        return details;
    }

    public long getPassedCount() {
        return checks.values().stream().filter(Boolean.TRUE::equals).count();
    }

    @Override
    public String toString() {
        return "Gate " + (passed ? "PASSED" : "FAILED") + ": "
                + getPassedCount() + "/" + checks.size() + " checks passed";
    }
}
