package com.deepansh.wordplay.core;

import com.deepansh.wordplay.model.AutonomyLevel;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only projection of an {@link ExecutionContext}, shown to the planner and returned
 * by the context endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextSummary(
        String sessionId,
        ProjectRef currentProject,
        DocumentRef currentDocument,
        Integer editorWordCount,
        int documentCount,
        int sourceCount,
        GoalRef activeGoal,
        List<String> memoryKeys,
        int historySize,
        AutonomyLevel autonomyLevel,
        List<String> availableTools
) {

    public record ProjectRef(Long id, String name, String type) {}

    public record DocumentRef(Long id, String title, Integer wordCount) {}

    public record GoalRef(String id, String description, String status) {}

    static ContextSummary of(ExecutionContext ctx, List<String> availableTools) {
        ProjectRef project = ctx.getCurrentProject() == null ? null : new ProjectRef(
                ctx.getCurrentProject().getId(), ctx.getCurrentProject().getName(), ctx.getCurrentProject().getType());
        DocumentRef document = ctx.getCurrentDocument() == null ? null : new DocumentRef(
                ctx.getCurrentDocument().getId(), ctx.getCurrentDocument().getTitle(), ctx.getCurrentDocument().getWordCount());
        GoalRef goal = ctx.activeGoal()
                .map(g -> new GoalRef(g.getId(), g.getDescription(), g.getStatus().wireName()))
                .orElse(null);

        return new ContextSummary(
                ctx.getSessionId(),
                project,
                document,
                ctx.getEditorState() != null ? ctx.getEditorState().getWordCount() : null,
                ctx.getProjectDocuments().size(),
                ctx.getProjectSources().size(),
                goal,
                new ArrayList<>(ctx.getPersistentMemory().keySet()),
                ctx.historySize(),
                ctx.getAutonomy() != null ? ctx.getAutonomy().getLevel() : null,
                availableTools != null ? availableTools : List.of());
    }
}
