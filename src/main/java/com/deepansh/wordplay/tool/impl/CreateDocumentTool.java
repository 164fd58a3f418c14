package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.persistence.Document;
import com.deepansh.wordplay.persistence.WritingStore;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Slf4j
@RequiredArgsConstructor
public class CreateDocumentTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .optional("projectId", ParameterType.INTEGER, "Owning project; defaults to the current project")
            .required("title", ParameterType.STRING, "Document title")
            .optional("content", ParameterType.STRING, "Initial body text")
            .build();

    private final WritingStore store;

    @Override
    public String getName() {
        return "create_document";
    }

    @Override
    public String getDescription() {
        return "Create a new document in a project.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.DOCUMENTS;
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

        Document document = store.createDocument(Document.builder()
                .projectId(projectId.get())
                .title(arguments.getString("title"))
                .content(arguments.getString("content", ""))
                .build());
        ToolSupport.refreshIfCurrent(context, projectId.get());

        log.info("Agent created document [id={}, projectId={}]", document.getId(), projectId.get());
        return ToolResult.ok(document, "Created document: " + document.getTitle());
    }
}
