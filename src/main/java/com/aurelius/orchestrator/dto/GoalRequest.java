package com.aurelius.orchestrator.dto;

/**
 * One goal to drive through the pipeline.
 *
 * Null limit / strict flag / binary paths fall back to configuration.
 */
public class GoalRequest {

    private final String goal;
    private final String dataPath;
    private final Double maxDrawdownLimit;
    private final Boolean strictMode;
    private final String engineCli;
    private final String memoryCli;

    public GoalRequest(
            String goal,
            String dataPath,
            Double maxDrawdownLimit,
            Boolean strictMode,
            String engineCli,
            String memoryCli
    ) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("goal must not be blank");
        }
        if (dataPath == null || dataPath.isBlank()) {
            throw new IllegalArgumentException("dataPath must not be blank");
        }
        this.goal = goal;
        this.dataPath = dataPath;
        this.maxDrawdownLimit = maxDrawdownLimit;
        this.strictMode = strictMode;
        this.engineCli = engineCli;
        this.memoryCli = memoryCli;
    }

    public static GoalRequest of(String goal, String dataPath) {
        return new GoalRequest(goal, dataPath, null, null, null, null);
    }

    public String getGoal() {
        return goal;
    }

    public String getDataPath() {
        return dataPath;
    }

    public Double getMaxDrawdownLimit() {
        return maxDrawdownLimit;
    }

    public Boolean getStrictMode() {
        return strictMode;
    }

    public String getEngineCli() {
        return engineCli;
    }

    public String getMemoryCli() {
        return memoryCli;
    }
}
