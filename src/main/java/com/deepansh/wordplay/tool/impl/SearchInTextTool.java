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
public class SearchInTextTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .optional("text", ParameterType.STRING, "Text to search; defaults to the editor content")
            .required("pattern", ParameterType.STRING, "Regular expression to find")
            .optional("caseSensitive", ParameterType.BOOLEAN, "Default: false")
            .build();

    @Override
    public String getName() {
        return "search_in_text";
    }

    @Override
    public String getDescription() {
        return "Search for a regex pattern within content (grep-style). Returns every match and the count.";
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
        TextOperations.GrepResult result = TextOperations.grep(text, arguments.getString("pattern"),
                arguments.getBoolean("caseSensitive", false));
        return ToolResult.ok(result, "Found " + result.count() + " matches");
    }
}
