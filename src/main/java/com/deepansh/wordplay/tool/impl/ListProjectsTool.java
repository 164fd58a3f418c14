package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.persistence.Project;
import com.deepansh.wordplay.persistence.WritingStore;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ListProjectsTool implements AgentTool {

    private final WritingStore store;

    @Override
    public String getName() {
        return "list_projects";
    }

    @Override
    public String getDescription() {
        return "Get all projects for the user.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.PROJECTS;
    }

    @Override
    public ToolParameters getParameters() {
        return ToolParameters.none();
    }

    @Override
    public ToolResult execute(ToolArguments arguments, ExecutionContext context) {
        List<Project> projects = store.getProjects(context.getUserId());
        return ToolResult.ok(projects, "Found " + projects.size() + " projects");
    }
}
