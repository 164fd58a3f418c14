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
import com.deepansh.wordplay.writing.StyleAnalysis;
import com.deepansh.wordplay.writing.WritingAssistant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Style metrics for explicit text, a stored document, or the editor, in that order.
 * When a document is named its metrics are saved back to it.
 */
@Component
@RequiredArgsConstructor
public class AnalyzeWritingStyleTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .optional("text", ParameterType.STRING, "Text to analyze")
            .optional("documentId", ParameterType.INTEGER, "Document to analyze when no text is given")
            .build();

    private final WritingAssistant writingAssistant;
    private final WritingStore store;

    @Override
    public String getName() {
        return "analyze_writing_style";
    }

    @Override
    public String getDescription() {
        return """
                Analyze the writing style of text: formality, complexity, coherence, engagement,
                conciseness and readability, each scored 0-100, plus tone and suggestions.
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.GENERATION;
    }

    @Override
    public ToolParameters getParameters() {
        return PARAMETERS;
    }

    @Override
    public ToolResult execute(ToolArguments arguments, ExecutionContext context) {
        Long documentId = arguments.getLong("documentId");
        String text;
        if (arguments.hasText("text")) {
            text = arguments.getString("text");
        } else if (documentId != null) {
            Optional<String> content = documentContent(documentId, context);
            if (content.isEmpty()) {
                return ToolResult.failure("Document not found");
            }
            text = content.get();
        } else {
            text = context.editorContent();
        }

        if (text.isBlank()) {
            return ToolResult.failure("No text to analyze: pass 'text' or 'documentId', or open a document");
        }

        StyleAnalysis analysis = writingAssistant.analyzeStyle(text, context.getModelSelection());
        if (documentId != null) {
            store.updateDocument(documentId, Document.builder().styleMetrics(analysis.toMetrics()).build());
        }
        return ToolResult.ok(analysis, analysis.isFallback()
                ? "Analyzed writing style (heuristic defaults, model unavailable)"
                : "Analyzed writing style");
    }

    private Optional<String> documentContent(long documentId, ExecutionContext context) {
        Document current = context.getCurrentDocument();
        if (current != null && Long.valueOf(documentId).equals(current.getId())) {
            return Optional.ofNullable(current.getContent());
        }
        return store.getDocument(documentId).map(Document::getContent);
    }
}
