package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.persistence.Source;
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
public class SaveSourceTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .optional("projectId", ParameterType.INTEGER, "Project to attach the source to; defaults to the current project")
            .requiredOneOf("type", "Kind of source", "url", "file", "pdf", "note")
            .required("name", ParameterType.STRING, "Display name, usually the page title")
            .optional("url", ParameterType.STRING, "Location of the source")
            .optional("content", ParameterType.STRING, "Captured text")
            .build();

    private final WritingStore store;

    @Override
    public String getName() {
        return "save_source";
    }

    @Override
    public String getDescription() {
        return "Save a research source to a project.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.RESEARCH;
    }

    @Override
    public ToolParameters getParameters() {
        return PARAMETERS;
    }

    @Override
    public ToolResult execute(ToolArguments arguments, ExecutionContext context) {
        Optional<Long> projectId = ToolSupport.projectId(arguments, context);
        if (projectId.isEmpty()) {
            return ToolResult.failure(ToolSupport.NO_PROJECT);
        }
        if (store.getProject(projectId.get()).isEmpty()) {
            return ToolResult.failure("Project not found");
        }

        Source source = store.createSource(Source.builder()
                .projectId(projectId.get())
                .type(arguments.getString("type"))
                .name(arguments.getString("name"))
                .url(arguments.getString("url"))
                .content(arguments.getString("content", ""))
                .build());
        ToolSupport.refreshIfCurrent(context, projectId.get());
        return ToolResult.ok(source, "Saved source: " + source.getName());
    }
}
