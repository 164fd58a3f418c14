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
public class GetDocumentTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("documentId", ParameterType.INTEGER, "Id of the document to load")
            .build();

    private final WritingStore store;

    @Override
    public String getName() {
        return "get_document";
    }

    @Override
    public String getDescription() {
        return "Get content and details of a specific document.";
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
        return store.getDocument(arguments.getLong("documentId"))
                .map(d -> ToolResult.ok(d, "Retrieved document: " + d.getTitle()))
                .orElseGet(() -> ToolResult.failure("Document not found"));
    }
}
