package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.Goal;
import com.deepansh.wordplay.model.GoalStatus;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class UpdateGoalStatusTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .optional("goalId", ParameterType.STRING, "Goal to update; defaults to the active goal")
            .requiredOneOf("status", "New status. Goals only move forward",
                    "pending", "in_progress", "completed", "failed")
            .optional("notes", ParameterType.STRING, "Outcome notes")
            .build();

    @Override
    public String getName() {
        return "update_goal_status";
    }

    @Override
    public String getDescription() {
        return "Update the status of a goal: pending -> in_progress -> completed or failed.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.MEMORY;
    }

    @Override
    public ToolParameters getParameters() {
        return PARAMETERS;
    }

    @Override
    public ToolResult execute(ToolArguments arguments, ExecutionContext context) {
        Optional<Goal> goal = arguments.hasText("goalId")
                ? context.findGoal(arguments.getString("goalId"))
                : context.activeGoal();
        if (goal.isEmpty()) {
            return ToolResult.failure(arguments.hasText("goalId")
                    ? "Goal not found: " + arguments.getString("goalId")
                    : "No active goal");
        }

        GoalStatus target = GoalStatus.fromWire(arguments.getString("status"));
        Goal g = goal.get();
        if (!g.getStatus().canTransitionTo(target)) {
            return ToolResult.failure("Goal " + g.getId() + " cannot move from "
                    + g.getStatus().wireName() + " to " + target.wireName());
        }
        context.advanceGoal(g, target, arguments.getString("notes"));
        return ToolResult.ok(g.snapshot(), "Goal " + g.getId() + " is now " + target.wireName());
    }
}
