package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.tool.ToolArguments;

import java.util.Optional;

/** Argument defaults shared by tools that fall back to session state. */
final class ToolSupport {

    static final String NO_PROJECT = "No projectId given and no project is active";

    private ToolSupport() {
    }

    /** Explicit projectId argument, else the session's current project. */
    static Optional<Long> projectId(ToolArguments args, ExecutionContext context) {
        Long explicit = args.getLong("projectId");
        return explicit != null ? Optional.of(explicit) : context.currentProjectId();
    }

    /** Explicit text argument, else the editor content; empty when neither has text. */
    static Optional<String> textOrEditor(ToolArguments args, String name, ExecutionContext context) {
        if (args.hasText(name)) {
            return Optional.of(args.getString(name));
        }
        String editor = context.editorContent();
        return editor.isBlank() ? Optional.empty() : Optional.of(editor);
    }

    /** Reloads the session's project lists when the change touched its current project. */
    static void refreshIfCurrent(ExecutionContext context, Long projectId) {
        if (projectId != null && context.currentProjectId().filter(projectId::equals).isPresent()) {
            context.refreshProjectData();
        }
    }
}
