package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.config.ToolProperties;
import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.ToolCall;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.persistence.Document;
import com.deepansh.wordplay.research.ScrapedPage;
import com.deepansh.wordplay.research.SearchResult;
import com.deepansh.wordplay.research.SearchResults;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Follow-up calls that are obviously useful after a successful tool, without a model
 * round-trip:
 *
 * | After                  | Condition            | Chain                                  |
 * |------------------------|----------------------|----------------------------------------|
 * | web_search             | ≥1 result            | scrape_webpage(top url) [+ save_source if a project is active] |
 * | scrape_webpage         | content present      | analyze_document_structure(prefix)      |
 * | create_document        | project active       | analyze_writing_style(new document)     |
 * | analyze_writing_style  | document active      | get_writing_suggestions(document text)  |
 *
 * Reads the context, never mutates it.
 */
@Component
@RequiredArgsConstructor
public class ChainingHeuristics {

    private final ToolProperties toolProperties;

    public List<ToolCall> nextTools(String previousTool, ToolResult result, ExecutionContext context) {
        List<ToolCall> chained = new ArrayList<>();
        if (result == null || !result.isSuccess() || previousTool == null) {
            return chained;
        }

        switch (previousTool) {
            case "web_search" -> chainFromSearch(result, context, chained);
            case "scrape_webpage" -> chainFromScrape(result, chained);
            case "create_document" -> chainFromDocumentCreation(result, context, chained);
            case "analyze_writing_style" -> chainFromStyleAnalysis(context, chained);
            default -> { }
        }
        return chained;
    }

    private void chainFromSearch(ToolResult result, ExecutionContext context, List<ToolCall> chained) {
        if (!(result.getData() instanceof SearchResults search) || search.isEmpty()) {
            return;
        }
        SearchResult top = search.results().get(0);
        if (top.url() == null || top.url().isBlank()) {
            return;
        }

        chained.add(ToolCall.of("scrape_webpage", Map.of("url", top.url()),
                "Auto-scraping top search result for detailed content"));

        context.currentProjectId().ifPresent(projectId -> {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("projectId", projectId);
            params.put("type", "url");
            params.put("name", top.title() != null && !top.title().isBlank() ? top.title() : "Web Source");
            params.put("url", top.url());
            params.put("content", "");
            chained.add(ToolCall.of("save_source", params, "Auto-saving research source to current project"));
        });
    }

    private void chainFromScrape(ToolResult result, List<ToolCall> chained) {
        if (!(result.getData() instanceof ScrapedPage page) || page.content() == null || page.content().isBlank()) {
            return;
        }
        int limit = toolProperties.getTextProcessing().getStructurePrefixLength();
        String prefix = page.content().length() > limit ? page.content().substring(0, limit) : page.content();
        chained.add(ToolCall.of("analyze_document_structure", Map.of("text", prefix),
                "Auto-analyzing scraped content structure"));
    }

    private void chainFromDocumentCreation(ToolResult result, ExecutionContext context, List<ToolCall> chained) {
        if (context.getCurrentProject() == null || !(result.getData() instanceof Document document)
                || document.getId() == null) {
            return;
        }
        chained.add(ToolCall.of("analyze_writing_style", Map.of("documentId", document.getId()),
                "Auto-analyzing newly created document style"));
    }

    /** Without document content the suggestions tool falls back to the editor. */
    private void chainFromStyleAnalysis(ExecutionContext context, List<ToolCall> chained) {
        Document current = context.getCurrentDocument();
        if (current == null) {
            return;
        }
        Map<String, Object> params = new LinkedHashMap<>();
        if (current.getContent() != null) {
            params.put("text", current.getContent());
        }
        params.put("type", "improvement");
        chained.add(ToolCall.of("get_writing_suggestions", params,
                "Auto-generating improvement suggestions based on style analysis"));
    }
}
