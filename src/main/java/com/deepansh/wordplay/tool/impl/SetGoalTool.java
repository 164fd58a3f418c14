package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.Goal;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Registers a goal on the session. With {@code parentGoalId} the goal becomes a sub-goal
 * of an existing one instead of a top-level goal.
 */
@Component
@Slf4j
public class SetGoalTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("description", ParameterType.STRING, "What the goal is")
            .optional("priority", ParameterType.INTEGER, "1 is highest. Default: 1")
            .optional("requiredTools", ParameterType.ARRAY, "Tool names expected to be needed")
            .optional("estimatedSteps", ParameterType.INTEGER, "Expected number of tool calls. Default: 5")
            .optional("parentGoalId", ParameterType.STRING, "Attach as a sub-goal of this goal")
            .build();

    @Override
    public String getName() {
        return "set_goal";
    }

    @Override
    public String getDescription() {
        return "Set a goal to track progress on a multi-step task.";
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
        Goal goal = new Goal(
                arguments.getString("description"),
                arguments.getInt("priority", 1),
                arguments.getStringList("requiredTools"),
                arguments.getInt("estimatedSteps", 5));

        if (arguments.hasText("parentGoalId")) {
            Optional<Goal> parent = context.findGoal(arguments.getString("parentGoalId"));
            if (parent.isEmpty()) {
                return ToolResult.failure("Parent goal not found: " + arguments.getString("parentGoalId"));
            }
            parent.get().addSubGoal(goal);
            return ToolResult.ok(goal, "Added sub-goal to " + parent.get().getId() + ": " + goal.getDescription());
        }

        context.addGoal(goal);
        log.debug("Goal [{}] set for session [{}]", goal.getId(), context.getSessionId());
        return ToolResult.ok(goal.snapshot(), "Goal set: " + goal.getDescription());
    }
}
