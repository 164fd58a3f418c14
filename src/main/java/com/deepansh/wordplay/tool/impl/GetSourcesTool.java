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

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class GetSourcesTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .optional("projectId", ParameterType.INTEGER, "Project to list; defaults to the current project")
            .build();

    private final WritingStore store;

    @Override
    public String getName() {
        return "get_sources";
    }

    @Override
    public String getDescription() {
        return "Get all research sources saved to a project.";
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
        List<Source> sources = store.getSources(projectId.get());
        return ToolResult.ok(sources, "Found " + sources.size() + " sources");
    }
}
