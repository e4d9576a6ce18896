package com.aurelius.orchestrator.dto;

import com.aurelius.core.fsm.State;
import com.aurelius.core.reflexion.RepairPlan;
import com.aurelius.core.tool.ToolType;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one goal run.
 *
 * Success carries the commit artifact id and backtest stats. Failure carries
 * the error and, when the retry budget ran out after a gate failure, the
 * last repair plan and its failure summary.
 */
public final class GoalRunResult {

    private final boolean success;
    private final String goal;
    private final String artifactId;
    private final JsonNode stats;
    private final String error;
    private final RepairPlan repairPlan;
    private final String failureSummary;
    private final int attempts;
    private final State finalState;
    private final List<State> stateHistory;
    private final List<ToolType> toolHistory;
    private final String outputDir;
    private final String response;

    private GoalRunResult(Builder b) {
        this.success        = b.success;
        this.goal           = b.goal;
        this.artifactId     = b.artifactId;
        this.stats          = b.stats;
        this.error          = b.error;
        this.repairPlan     = b.repairPlan;
        this.failureSummary = b.failureSummary;
        this.attempts       = b.attempts;
        this.finalState     = b.finalState;
        this.stateHistory   = b.stateHistory != null ? List.copyOf(b.stateHistory) : Collections.emptyList();
        this.toolHistory    = b.toolHistory != null ? List.copyOf(b.toolHistory) : Collections.emptyList();
        this.outputDir      = b.outputDir;
        this.response       = b.response;
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public boolean isSuccess()           { return success; }
    public String getGoal()              { return goal; }
    public String getArtifactId()        { return artifactId; }
    public JsonNode getStats()           { return stats; }
    public String getError()             { return error; }
    public RepairPlan getRepairPlan()    { return repairPlan; }
    public String getFailureSummary()    { return failureSummary; }
    public int getAttempts()             { return attempts; }
    public State getFinalState()         { return finalState; }
    public List<State> getStateHistory() { return stateHistory; }
    public List<ToolType> getToolHistory() { return toolHistory; }
    public String getOutputDir()         { return outputDir; }
    public String getResponse()          { return response; }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(boolean success, String goal) {
        return new Builder(success, goal);
    }

    public static final class Builder {
        private final boolean success;
        private final String goal;
        private String artifactId;
        private JsonNode stats;
        private String error;
        private RepairPlan repairPlan;
        private String failureSummary;
        private int attempts;
        private State finalState;
        private List<State> stateHistory;
        private List<ToolType> toolHistory;
        private String outputDir;
        private String response;

        private Builder(boolean success, String goal) {
            this.success = success;
            this.goal = goal;
        }

        public Builder artifactId(String v)            { this.artifactId = v;     return this; }
        public Builder stats(JsonNode v)               { this.stats = v;          return this; }
        public Builder error(String v)                 { this.error = v;          return this; }
        public Builder repairPlan(RepairPlan v)        { this.repairPlan = v;     return this; }
        public Builder failureSummary(String v)        { this.failureSummary = v; return this; }
        public Builder attempts(int v)                 { this.attempts = v;       return this; }
        public Builder finalState(State v)             { this.finalState = v;     return this; }
        public Builder stateHistory(List<State> v)     { this.stateHistory = v;   return this; }
        public Builder toolHistory(List<ToolType> v)   { this.toolHistory = v;    return this; }
        public Builder outputDir(String v)             { this.outputDir = v;      return this; }
        public Builder response(String v)              { this.response = v;       return this; }

        public GoalRunResult build() { return new GoalRunResult(this); }
    }

    @Override
    public String toString() {
        return success
                ? "GoalRunResult{success, artifact=" + artifactId + ", attempts=" + attempts + "}"
                : "GoalRunResult{failed, error='" + error + "', attempts=" + attempts + ", state=" + finalState + "}";
    }
}
