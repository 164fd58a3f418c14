package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.exception.ResearchException;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.research.ScrapedPage;
import com.deepansh.wordplay.research.WebResearchClient;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeWebpageTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("url", ParameterType.STRING, "Absolute http(s) URL of the page")
            .build();

    private final WebResearchClient researchClient;

    @Override
    public String getName() {
        return "scrape_webpage";
    }

    @Override
    public String getDescription() {
        return "Extract the readable text content of a specific URL.";
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
        String url = arguments.getString("url");
        try {
            ScrapedPage page = researchClient.scrape(url);
            return ToolResult.ok(page, "Extracted " + page.wordCount() + " words from " + page.domain());
        } catch (ResearchException e) {
            log.warn("Scrape failed for {}: {}", url, e.getMessage());
            return ToolResult.failure(e.getMessage());
        }
    }
}
