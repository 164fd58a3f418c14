package com.deepansh.wordplay.agent;

/** Why the autonomous loop ended. Budget exhaustion is a normal outcome, not an error. */
public enum StopReason {

    NO_TOOLS_REQUIRED("no tools required"),
    LOW_SUCCESS_RATE("low success rate"),
    TASK_COMPLETE("task complete"),
    ITERATION_LIMIT("approaching iteration limit"),
    DECLINING_PROGRESS("declining progress"),
    TIME_BUDGET_EXCEEDED("time budget exceeded");

    private final String description;

    StopReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
