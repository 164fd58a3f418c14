package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.research.SearchResults;
import com.deepansh.wordplay.research.WebResearchClient;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Web search through the configured research client.
 *
 * Output: a {@link SearchResults} with title, URL and snippet per hit plus the provider's
 * summary. Provider outages still succeed with simulated results and {@code error} set, so
 * the chained scrape has something to work on.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebSearchTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("query", ParameterType.STRING,
                    "The search query. Be specific for better results. E.g: 'history of the printing press'")
            .optionalOneOf("source", "Where to search. Default: web", "web", "news", "academic")
            .build();

    private final WebResearchClient researchClient;

    @Override
    public String getName() {
        return "web_search";
    }

    @Override
    public String getDescription() {
        return """
                Search the web for current information, news, articles, or any topic.
                Returns the top results with titles, URLs, and summaries.
                Use this when the user needs research or facts you don't know.
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.RESEARCH;
    }

    @Override
    public ToolParameters getParameters() {
        return PARAMETERS;
    }

    @Override
    public ToolResult execute(ToolArguments arguments, ExecutionContext context) {
        String query = arguments.getString("query");
        if (query.isBlank()) {
            return ToolResult.failure("'query' must not be blank for web_search");
        }

        SearchResults results = researchClient.search(query, arguments.getString("source", "web"));
        if (results.error() != null) {
            log.warn("Web search degraded for query='{}': {}", query, results.error());
        }
        return ToolResult.ok(results,
                "Found " + results.results().size() + " search results for: " + query);
    }
}
