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
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class UpdateDocumentTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("documentId", ParameterType.INTEGER, "Document to update")
            .optional("title", ParameterType.STRING, "New title")
            .optional("content", ParameterType.STRING, "New body text; replaces the existing content")
            .build();

    private final WritingStore store;

    @Override
    public String getName() {
        return "update_document";
    }

    @Override
    public String getDescription() {
        return "Update document content or title. Word count is recalculated.";
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
        long documentId = arguments.getLong("documentId");
        Optional<Document> updated = store.updateDocument(documentId, Document.builder()
                .title(arguments.getString("title"))
                .content(arguments.getString("content"))
                .build());

        if (updated.isEmpty()) {
            return ToolResult.failure("Document not found");
        }
        Document document = updated.get();
        if (context.getCurrentDocument() != null && Long.valueOf(documentId).equals(context.getCurrentDocument().getId())) {
            context.selectDocument(document);
        }
        ToolSupport.refreshIfCurrent(context, document.getProjectId());
        return ToolResult.ok(document, "Updated document: " + document.getTitle());
    }
}
