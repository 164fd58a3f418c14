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

import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
@RequiredArgsConstructor
public class DeleteDocumentTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("documentId", ParameterType.INTEGER, "Document to delete")
            .build();

    private final WritingStore store;

    @Override
    public String getName() {
        return "delete_document";
    }

    @Override
    public String getDescription() {
        return """
                Permanently delete a document. Only use when the user explicitly asks for deletion.
                """;
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
        Optional<Document> existing = store.getDocument(documentId);
        if (existing.isEmpty() || !store.deleteDocument(documentId)) {
            return ToolResult.failure("Document not found");
        }

        if (context.getCurrentDocument() != null && Long.valueOf(documentId).equals(context.getCurrentDocument().getId())) {
            context.selectDocument(null);
        }
        ToolSupport.refreshIfCurrent(context, existing.get().getProjectId());

        log.info("Agent deleted document [id={}]", documentId);
        return ToolResult.ok(Map.of("documentId", documentId, "deleted", true),
                "Deleted document: " + existing.get().getTitle());
    }
}
