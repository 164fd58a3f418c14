package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.text.TextOperations;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import org.springframework.stereotype.Component;

@Component
public class AnalyzeDocumentStatsTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .optional("text", ParameterType.STRING, "Text to measure; defaults to the editor content")
            .build();

    @Override
    public String getName() {
        return "analyze_document_stats";
    }

    @Override
    public String getDescription() {
        return "Count words, characters, sentences and paragraphs, and estimate reading time.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.TEXT_PROCESSING;
    }

    @Override
    public ToolParameters getParameters() {
        return PARAMETERS;
    }

    @Override
    public ToolResult execute(ToolArguments arguments, ExecutionContext context) {
        String text = ToolSupport.textOrEditor(arguments, "text", context).orElse("");
        TextOperations.DocumentStats stats = TextOperations.analyze(text);
        return ToolResult.ok(stats, "Document has " + stats.wordCount() + " words in "
                + stats.paragraphCount() + " paragraphs");
    }
}
