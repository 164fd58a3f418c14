package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.persistence.Project;
import com.deepansh.wordplay.persistence.WritingStore;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class UpdateProjectTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("projectId", ParameterType.INTEGER, "Project to update")
            .optional("name", ParameterType.STRING, "New name")
            .optional("type", ParameterType.STRING, "New type")
            .optional("style", ParameterType.STRING, "New style")
            .build();

    private final WritingStore store;

    @Override
    public String getName() {
        return "update_project";
    }

    @Override
    public String getDescription() {
        return "Update project details. Only the fields given are changed.";
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
        long projectId = arguments.getLong("projectId");
        Optional<Project> updated = store.updateProject(projectId, Project.builder()
                .name(arguments.getString("name"))
                .type(arguments.getString("type"))
                .style(arguments.getString("style"))
                .build());

        if (updated.isEmpty()) {
            return ToolResult.failure("Project not found");
        }
        Project project = updated.get();
        if (context.currentProjectId().filter(id -> id == projectId).isPresent()) {
            context.selectProject(project);
        }
        return ToolResult.ok(project, "Updated project: " + project.getName());
    }
}
