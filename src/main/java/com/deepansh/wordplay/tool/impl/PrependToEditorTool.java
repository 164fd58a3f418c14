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
public class PrependToEditorTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("content", ParameterType.STRING, "Text to add at the start")
            .optional("separator", ParameterType.STRING, "Inserted between new and existing text. Default: blank line")
            .build();

    @Override
    public String getName() {
        return "prepend_to_editor";
    }

    @Override
    public String getDescription() {
        return "Insert text at the beginning of the editor content.";
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

        String updated = existing.isEmpty() ? addition : addition + separator + existing;
        EditorState state = context.replaceEditorContent(updated);
        return ToolResult.ok(state, "Prepended " + TextOperations.countWords(addition) + " words to editor");
    }
}
