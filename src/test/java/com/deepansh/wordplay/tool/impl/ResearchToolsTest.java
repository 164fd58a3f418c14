package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.exception.ResearchException;
import com.deepansh.wordplay.model.ContextUpdate;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.persistence.InMemoryWritingStore;
import com.deepansh.wordplay.research.SearchResult;
import com.deepansh.wordplay.research.SearchResults;
import com.deepansh.wordplay.research.WebResearchClient;
import com.deepansh.wordplay.tool.ToolExecutor;
import com.deepansh.wordplay.tool.ToolFixtures;
import com.deepansh.wordplay.tool.ToolRegistry;
import com.deepansh.wordplay.writing.WritingAssistant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResearchToolsTest {

    @Mock WebResearchClient researchClient;

    private ExecutionContext context;
    private ToolExecutor executor;

    @BeforeEach
    void setUp() {
        InMemoryWritingStore store = new InMemoryWritingStore();
        executor = new ToolExecutor(new ToolRegistry(ToolFixtures.allTools(store,
                mock(WritingAssistant.class), researchClient)));
        context = ToolFixtures.context(store);
    }

    @Test
    void webSearch_defaultsSourceToWeb() {
        when(researchClient.search("tides", "web")).thenReturn(new SearchResults(
                List.of(new SearchResult("Tides", "Moon", "https://a.example")), null, null));

        ToolResult result = executor.execute("web_search", Map.of("query", "tides"), null, context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Found 1 search results for: tides");
    }

    @Test
    void webSearch_unsupportedSource_rejectedBeforeSearch() {
        ToolResult result = executor.execute("web_search", Map.of("query", "tides", "source", "tv"), null, context);

        assertThat(result.isSuccess()).isFalse();
        verifyNoInteractions(researchClient);
    }

    @Test
    void webSearch_academicSource_passedThrough() {
        when(researchClient.search("tides", "academic")).thenReturn(new SearchResults(List.of(), null, null));

        executor.execute("web_search", Map.of("query", "tides", "source", "Academic"), null, context);

        verify(researchClient).search("tides", "academic");
    }

    @Test
    void scrape_clientFailure_becomesToolFailure() {
        when(researchClient.scrape("https://a.example"))
                .thenThrow(new ResearchException("Insufficient content extracted from webpage"));

        ToolResult result = executor.execute("scrape_webpage", Map.of("url", "https://a.example"), null, context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("Insufficient content");
    }

    @Test
    void saveSource_withoutProject_fails() {
        ToolResult result = executor.execute("save_source",
                Map.of("type", "url", "name", "Page", "url", "https://a.example"), null, context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo(ToolSupport.NO_PROJECT);
    }

    @Test
    void saveSource_currentProject_refreshesSources() {
        context.update(ContextUpdate.builder().currentProjectId(1L).build());

        executor.execute("save_source", Map.of("type", "note", "name", "Idea", "content", "Tides"), null, context);
        ToolResult listed = executor.execute("get_sources", Map.of(), null, context);

        assertThat(context.getProjectSources()).hasSize(1);
        assertThat(listed.getMessage()).isEqualTo("Found 1 sources");
    }
}
