package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.EditorState;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.text.TextOperations;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import org.springframework.stereotype.Component;

@Component
public class AppendToEditorTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("content", ParameterType.STRING, "Text to add at the end")
            .optional("separator", ParameterType.STRING, "Inserted between existing and new text. Default: blank line")
            .build();

    @Override
    public String getName() {
        return "append_to_editor";
    }

    @Override
    public String getDescription() {
        return "Append text to the end of the editor content.";
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
        String addition = arguments.getString("content");
        String existing = context.editorContent();
        String separator = arguments.getString("separator", "\n\n");

        String updated = existing.isEmpty() ? addition : existing + separator + addition;
        EditorState state = context.replaceEditorContent(updated);
        return ToolResult.ok(state, "Appended " + TextOperations.countWords(addition) + " words to editor");
    }
}
