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
public class ReplaceInTextTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .optional("text", ParameterType.STRING, "Text to transform; defaults to the editor content")
            .required("pattern", ParameterType.STRING, "Regular expression to replace")
            .required("replacement", ParameterType.STRING, "Literal replacement text")
            .optional("global", ParameterType.BOOLEAN, "Replace every match. Default: true")
            .optional("caseSensitive", ParameterType.BOOLEAN, "Default: true")
            .build();

    @Override
    public String getName() {
        return "replace_in_text";
    }

    @Override
    public String getDescription() {
        return """
                Replace text patterns in content (sed-style) and return the result.
                Does not modify the editor; use regex_replace_in_editor for that.
                """;
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
        TextOperations.ReplaceResult result = TextOperations.replace(text,
                arguments.getString("pattern"),
                arguments.getString("replacement"),
                arguments.getBoolean("global", true),
                arguments.getBoolean("caseSensitive", true));
        return ToolResult.ok(result, "Text replacement completed: " + result.count() + " replacements");
    }
}
