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

import java.util.Map;

/** sed-style replacement applied to the editor in place. No match leaves the editor untouched. */
@Component
public class RegexReplaceInEditorTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("pattern", ParameterType.STRING, "Regular expression to replace")
            .required("replacement", ParameterType.STRING, "Literal replacement text")
            .optional("global", ParameterType.BOOLEAN, "Replace every match. Default: true")
            .optional("caseSensitive", ParameterType.BOOLEAN, "Default: true")
            .build();

    @Override
    public String getName() {
        return "regex_replace_in_editor";
    }

    @Override
    public String getDescription() {
        return "Find and replace a regex pattern directly in the editor content.";
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
        TextOperations.ReplaceResult result = TextOperations.replace(context.editorContent(),
                arguments.getString("pattern"),
                arguments.getString("replacement"),
                arguments.getBoolean("global", true),
                arguments.getBoolean("caseSensitive", true));

        if (result.count() == 0) {
            return ToolResult.ok(Map.of("replacements", 0),
                    "No matches for pattern '" + arguments.getString("pattern") + "'; editor unchanged");
        }
        EditorState state = context.replaceEditorContent(result.result());
        return ToolResult.ok(Map.of("replacements", result.count(), "editorState", state),
                "Replaced " + result.count() + " occurrences in editor");
    }
}
