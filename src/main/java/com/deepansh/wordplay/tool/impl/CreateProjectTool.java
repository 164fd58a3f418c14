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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class CreateProjectTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("name", ParameterType.STRING, "Project name")
            .optional("type", ParameterType.STRING, "Kind of work, e.g. 'Novel', 'Article', 'Research Paper'")
            .optional("style", ParameterType.STRING, "Intended writing style, e.g. 'Creative', 'Academic'")
            .build();

    private final WritingStore store;

    @Override
    public String getName() {
        return "create_project";
    }

    @Override
    public String getDescription() {
        return "Create a new writing project.";
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
        Project project = store.createProject(Project.builder()
                .userId(context.getUserId())
                .name(arguments.getString("name"))
                .type(arguments.getString("type", "General"))
                .style(arguments.getString("style", "Neutral"))
                .build());
        log.info("Agent created project [id={}, name={}]", project.getId(), project.getName());
        return ToolResult.ok(project, "Created project: " + project.getName());
    }
}
