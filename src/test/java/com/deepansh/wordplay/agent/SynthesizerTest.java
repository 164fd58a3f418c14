package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.exception.ModelCallException;
import com.deepansh.wordplay.llm.LlmClient;
import com.deepansh.wordplay.llm.ModelReplyParser;
import com.deepansh.wordplay.model.SynthesisResult;
import com.deepansh.wordplay.model.ToolCall;
import com.deepansh.wordplay.model.ToolExecution;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.persistence.InMemoryWritingStore;
import com.deepansh.wordplay.research.SearchResult;
import com.deepansh.wordplay.research.SearchResults;
import com.deepansh.wordplay.research.WebResearchClient;
import com.deepansh.wordplay.tool.ToolFixtures;
import com.deepansh.wordplay.tool.ToolRegistry;
import com.deepansh.wordplay.writing.WritingAssistant;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SynthesizerTest {

    @Mock LlmClient llmClient;

    private Synthesizer synthesizer;

    private final List<ToolExecution> executions = List.of(ToolExecution.builder()
            .toolName("web_search")
            .parameters(Map.of("query", "typewriters"))
            .result(ToolResult.ok(new SearchResults(List.of(
                    new SearchResult("History", "snippet", "https://a.example")), null, null), "Found 1"))
            .build());

    @BeforeEach
    void setUp() {
        ToolRegistry registry = new ToolRegistry(ToolFixtures.allTools(new InMemoryWritingStore(),
                mock(WritingAssistant.class), mock(WebResearchClient.class)));
        synthesizer = new Synthesizer(llmClient, new ModelReplyParser(new ObjectMapper()), registry,
                new TemplateSynthesizer(registry));
    }

    @Test
    void synthesize_modelReply_keepsKnownAdditionalCalls() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("""
                {"narrative": "I found one good source.",
                 "suggestedActions": ["Read it"],
                 "additionalToolCalls": [
                   {"tool": "scrape_webpage", "params": {"url": "https://a.example"}, "reasoning": "details"},
                   {"tool": "order_pizza", "params": {}}
                 ]}""");

        SynthesisResult result = synthesizer.synthesize("Research typewriters", executions, null);

        assertThat(result.isFallback()).isFalse();
        assertThat(result.getNarrative()).isEqualTo("I found one good source.");
        assertThat(result.getSuggestedActions()).containsExactly("Read it");
        assertThat(result.getAdditionalToolCalls()).extracting(ToolCall::getToolName)
                .containsExactly("scrape_webpage");
        assertThat(result.getContinuousOperationPlan().getNextPhase()).isEqualTo("Content Extraction");
        assertThat(result.getResearchFindings()).hasSize(1);
    }

    @Test
    void synthesize_modelDown_usesTemplate() {
        when(llmClient.complete(anyString(), anyString(), any())).thenThrow(new ModelCallException("down"));

        SynthesisResult result = synthesizer.synthesize("Research typewriters", executions, null);

        assertThat(result.isFallback()).isTrue();
        assertThat(result.getNarrative()).contains("I completed 1 of 1 operations");
        assertThat(result.hasAdditionalToolCalls()).isFalse();
    }

    @Test
    void synthesize_replyWithoutNarrative_usesTemplate() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("{\"suggestedActions\": []}");

        assertThat(synthesizer.synthesize("r", executions, null).isFallback()).isTrue();
    }

    @Test
    void synthesize_emptySuggestions_fallBackToTemplateSuggestions() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("{\"response\": \"Done.\"}");

        SynthesisResult result = synthesizer.synthesize("r", executions, null);

        assertThat(result.getNarrative()).isEqualTo("Done.");
        assertThat(result.getSuggestedActions()).isNotEmpty();
    }
}
