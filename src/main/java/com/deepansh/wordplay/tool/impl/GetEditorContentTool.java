package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.EditorState;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import org.springframework.stereotype.Component;

@Component
public class GetEditorContentTool implements AgentTool {

    @Override
    public String getName() {
        return "get_editor_content";
    }

    @Override
    public String getDescription() {
        return "Read the current editor title, content and word count.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.EDITOR;
    }

    @Override
    public ToolParameters getParameters() {
        return ToolParameters.none();
    }

    @Override
    public ToolResult execute(ToolArguments arguments, ExecutionContext context) {
        EditorState state = context.getEditorState() != null
                ? context.getEditorState()
                : EditorState.of(null, "", false);
        return ToolResult.ok(state, "Editor has " + state.getWordCount() + " words");
    }
}
