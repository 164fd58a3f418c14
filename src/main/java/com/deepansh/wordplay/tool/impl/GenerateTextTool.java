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

import java.util.Map;

/**
 * Model-backed text generation. A model failure fails the call; there is no
 * template substitute for generated prose.
 */
@Component
@RequiredArgsConstructor
public class GenerateTextTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("prompt", ParameterType.STRING, "What to write, e.g. 'Write an opening paragraph about tides'")
            .optional("context", ParameterType.STRING, "Text to continue from; defaults to the editor content")
            .optional("style", ParameterType.ANY, "Style hints: a description or a metrics object")
            .build();

    private final WritingAssistant writingAssistant;

    @Override
    public String getName() {
        return "generate_text";
    }

    @Override
    public String getDescription() {
        return """
                Generate text content using AI, continuing or expanding the given context
                in the same style. Does not modify the editor; use append_to_editor for that.
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
        String source = ToolSupport.textOrEditor(arguments, "context", context).orElse("");
        Object style = arguments.get("style");
        Map<String, Object> styleHints = style instanceof Map<?, ?> ? arguments.getMap("style")
                : style != null ? Map.of("description", style.toString()) : Map.of();

        String generated = writingAssistant.generateText(source, styleHints,
                arguments.getString("prompt"), context.getModelSelection());
        return ToolResult.ok(generated, "Generated text content");
    }
}
