package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import com.deepansh.wordplay.writing.WritingAssistant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class GetWritingSuggestionsTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .optional("text", ParameterType.STRING, "Text to improve; defaults to the editor content")
            .optionalOneOf("type", "Kind of suggestion. Default: improvement",
                    "improvement", "continuation", "clarity", "style", "grammar")
            .build();

    private final WritingAssistant writingAssistant;

    @Override
    public String getName() {
        return "get_writing_suggestions";
    }

    @Override
    public String getDescription() {
        return "Get AI suggestions for improving or continuing text.";
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
        Optional<String> text = ToolSupport.textOrEditor(arguments, "text", context);
        if (text.isEmpty()) {
            return ToolResult.failure("No text to review: pass 'text' or open a document");
        }

        Map<String, Object> style = context.getCurrentDocument() != null
                && context.getCurrentDocument().getStyleMetrics() != null
                ? context.getCurrentDocument().getStyleMetrics()
                : Map.of();
        List<String> suggestions = writingAssistant.suggestions(text.get(), style,
                arguments.getString("type", "improvement"), context.getModelSelection());
        return ToolResult.ok(suggestions, "Generated " + suggestions.size() + " writing suggestions");
    }
}
