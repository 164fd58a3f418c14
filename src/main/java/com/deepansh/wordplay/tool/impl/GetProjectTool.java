package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.persistence.WritingStore;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GetProjectTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("projectId", ParameterType.INTEGER, "Id of the project to load")
            .build();

    private final WritingStore store;

    @Override
    public String getName() {
        return "get_project";
    }

    @Override
    public String getDescription() {
        return "Get details of a specific project.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.PROJECTS;
    }

    @Override
    public ToolParameters getParameters() {
        return PARAMETERS;
    }

    @Override
    public ToolResult execute(ToolArguments arguments, ExecutionContext context) {
        return store.getProject(arguments.getLong("projectId"))
                .map(p -> ToolResult.ok(p, "Retrieved project: " + p.getName()))
                .orElseGet(() -> ToolResult.failure("Project not found"));
    }
}
