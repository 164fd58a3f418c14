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

import java.util.Optional;

@Component
public class AnalyzeDocumentStructureTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .optional("text", ParameterType.STRING, "Text to analyze; defaults to the editor content")
            .build();

    @Override
    public String getName() {
        return "analyze_document_structure";
    }

    @Override
    public String getDescription() {
        return "Analyze the structure of a document: title and numbered paragraphs.";
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
        Optional<String> text = ToolSupport.textOrEditor(arguments, "text", context);
        if (text.isEmpty()) {
            return ToolResult.failure("No text to analyze");
        }
        TextOperations.DocumentStructure structure = TextOperations.extractStructure(text.get());
        return ToolResult.ok(structure,
                "Analyzed document structure: " + structure.paragraphs().size() + " paragraphs");
    }
}
