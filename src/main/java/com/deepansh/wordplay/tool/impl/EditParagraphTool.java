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

import java.util.List;

/**
 * Paragraph-targeted editor change. Paragraphs are zero-indexed blocks separated by blank
 * lines, as numbered by analyze_document_structure.
 */
@Component
public class EditParagraphTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("paragraphIndex", ParameterType.INTEGER, "Zero-based paragraph index")
            .optional("content", ParameterType.STRING, "New paragraph text; required except for delete")
            .optionalOneOf("operation", "Default: replace", "replace", "insert_before", "insert_after", "delete")
            .build();

    @Override
    public String getName() {
        return "edit_paragraph";
    }

    @Override
    public String getDescription() {
        return """
                Replace, delete, or insert next to a single paragraph of the editor content.
                Use analyze_document_structure first to find the paragraph index.
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
        List<String> paragraphs = TextOperations.splitParagraphs(context.editorContent());
        int index = arguments.getInt("paragraphIndex", -1);
        String operation = arguments.getString("operation", "replace");

        if (index < 0 || index >= paragraphs.size()) {
            return ToolResult.failure(paragraphs.isEmpty()
                    ? "Editor has no paragraphs"
                    : "Paragraph index " + index + " out of range (0-" + (paragraphs.size() - 1) + ")");
        }
        if (!operation.equals("delete") && !arguments.hasText("content")) {
            return ToolResult.failure("'content' is required for operation " + operation);
        }

        String content = arguments.getString("content");
        switch (operation) {
            case "delete" -> paragraphs.remove(index);
            case "insert_before" -> paragraphs.add(index, content.strip());
            case "insert_after" -> paragraphs.add(index + 1, content.strip());
            default -> paragraphs.set(index, content.strip());
        }

        EditorState state = context.replaceEditorContent(TextOperations.joinParagraphs(paragraphs));
        return ToolResult.ok(state, "Paragraph " + index + " " + describe(operation));
    }

    private static String describe(String operation) {
        return switch (operation) {
            case "delete" -> "deleted";
            case "insert_before" -> "preceded by new paragraph";
            case "insert_after" -> "followed by new paragraph";
            default -> "replaced";
        };
    }
}
