package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.EditorState;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import org.springframework.stereotype.Component;

@Component
public class ReplaceEditorContentTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("content", ParameterType.STRING, "The complete new editor content")
            .build();

    @Override
    public String getName() {
        return "replace_editor_content";
    }

    @Override
    public String getDescription() {
        return """
                Replace the entire editor content. Prefer edit_paragraph or regex_replace_in_editor
                for targeted changes.
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.EDITOR;
    }

    @Override
    public ToolParameters getParameters() {
        return PARAMETERS;
    }

    @Override
    public ToolResult execute(ToolArguments arguments, ExecutionContext context) {
        EditorState state = context.replaceEditorContent(arguments.getString("content"));
        return ToolResult.ok(state, "Replaced editor content (" + state.getWordCount() + " words)");
    }
}
