package com.aurelius.core.reflexion;

import java.util.Collections;
import java.util.List;

/**
 * Structured suggestion produced after a gate failure.
 */
public class RepairPlan {

    private final FailureType failureType;
    private final String description;
    private final List<String> actions;
    private final RetryStage retryState;

    public RepairPlan(FailureType failureType, String description, List<String> actions, RetryStage retryState) {
        this.failureType = failureType;
        this.description = description;
        this.actions = actions != null ? List.copyOf(actions) : Collections.emptyList();
        this.retryState = retryState;
    }

    public FailureType getFailureType() {
        return failureType;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getActions() {
        return actions;
    }

    public RetryStage getRetryState() {
        return retryState;
    }

    @Override
    public String toString() {
        return "RepairPlan{" + failureType.getCode() + ", retry=" + retryState.getName()
                + ", actions=" + actions.size() + "}";
    }
}
