package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import com.deepansh.wordplay.writing.TextCommandResult;
import com.deepansh.wordplay.writing.WritingAssistant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProcessTextCommandTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("command", ParameterType.STRING,
                    "Natural language or grep/sed-style command, e.g. \"replace 'colour' 'color'\"")
            .optional("text", ParameterType.STRING, "Text to operate on; defaults to the editor content")
            .build();

    private final WritingAssistant writingAssistant;

    @Override
    public String getName() {
        return "process_text_command";
    }

    @Override
    public String getDescription() {
        return """
                Process a natural language command about text (find, replace, reformat, summarize).
                Returns the resulting text without modifying the editor.
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
        String text = ToolSupport.textOrEditor(arguments, "text", context).orElse("");
        TextCommandResult result = writingAssistant.processCommand(text, arguments.getString("command"),
                context.getModelSelection());
        return ToolResult.ok(result, result.message());
    }
}
