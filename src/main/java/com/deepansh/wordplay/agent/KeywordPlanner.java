package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.AgentPlan;
import com.deepansh.wordplay.model.ToolCall;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic plan used when the planning model is unreachable.
 * Matches a handful of request keywords to tools; anything else gets a clarifying reply.
 */
final class KeywordPlanner {

    static final String CLARIFYING_RESPONSE =
            "I'm here to help with your writing project. Could you be more specific about what you'd like me to do?";

    private static final List<String> RESEARCH_WORDS =
            List.of("research", "search", "look up", "find information", "latest", "news about");
    private static final List<String> STATS_WORDS = List.of("word count", "statistics", "stats", "reading time");
    private static final List<String> STRUCTURE_WORDS = List.of("structure", "outline", "paragraphs");
    private static final List<String> STYLE_WORDS = List.of("style", "tone", "formality");
    private static final List<String> SUGGESTION_WORDS = List.of("suggest", "improve", "feedback");

    private KeywordPlanner() {
    }

    static AgentPlan plan(String request, ExecutionContext context) {
        String lower = request.toLowerCase(Locale.ROOT);
        String editorText = context.editorContent();
        boolean hasText = editorText != null && !editorText.isBlank();

        List<ToolCall> calls = new ArrayList<>();
        if (containsAny(lower, RESEARCH_WORDS)) {
            calls.add(ToolCall.of("web_search", Map.of("query", request),
                    "Research requested; searching the web directly"));
        }
        if (hasText && containsAny(lower, STATS_WORDS)) {
            calls.add(ToolCall.of("analyze_document_stats", Map.of(), "Statistics requested for the editor content"));
        }
        if (hasText && containsAny(lower, STRUCTURE_WORDS)) {
            calls.add(ToolCall.of("analyze_document_structure", Map.of(),
                    "Structure requested for the editor content"));
        }
        if (hasText && containsAny(lower, STYLE_WORDS)) {
            calls.add(ToolCall.of("analyze_writing_style", Map.of(), "Style analysis requested for the editor content"));
        }
        if (hasText && containsAny(lower, SUGGESTION_WORDS)) {
            calls.add(ToolCall.of("get_writing_suggestions", Map.of("text", editorText, "type", "improvement"),
                    "Suggestions requested for the editor content"));
        }

        return AgentPlan.builder()
                .plan("Processing request: \"" + request + "\"")
                .toolCalls(calls)
                .response(calls.isEmpty() ? CLARIFYING_RESPONSE : null)
                .fallback(true)
                .build();
    }

    private static boolean containsAny(String text, List<String> words) {
        return words.stream().anyMatch(text::contains);
    }
}
