package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.exception.ModelCallException;
import com.deepansh.wordplay.llm.LlmClient;
import com.deepansh.wordplay.llm.ModelReplyParser;
import com.deepansh.wordplay.model.AgentPlan;
import com.deepansh.wordplay.model.ContextUpdate;
import com.deepansh.wordplay.model.ToolCall;
import com.deepansh.wordplay.persistence.InMemoryWritingStore;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlannerTest {

    @Mock LlmClient llmClient;

    private Planner planner;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        InMemoryWritingStore store = new InMemoryWritingStore();
        ToolRegistry registry = new ToolRegistry(ToolFixtures.allTools(store,
                mock(WritingAssistant.class), mock(WebResearchClient.class)));
        planner = new Planner(llmClient, new ModelReplyParser(new ObjectMapper()), registry);
        context = ToolFixtures.context(store);
    }

    @Test
    void plan_jsonReply_returnsToolCalls() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("""
                ```json
                {"needsTools": true, "plan": "Search first",
                 "toolCalls": [{"tool": "web_search", "params": {"query": "typewriters"}, "reasoning": "research"}]}
                ```""");

        AgentPlan plan = planner.plan("Research typewriters", context);

        assertThat(plan.isFallback()).isFalse();
        assertThat(plan.getPlan()).isEqualTo("Search first");
        assertThat(plan.getToolCalls()).singleElement().satisfies(call -> {
            assertThat(call.getToolName()).isEqualTo("web_search");
            assertThat(call.getArguments()).containsEntry("query", "typewriters");
        });
    }

    @Test
    void plan_unknownToolInReply_isDropped() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("""
                {"plan": "p", "toolCalls": [{"tool": "launch_rocket"}, {"name": "list_projects"}]}""");

        AgentPlan plan = planner.plan("Show my projects", context);

        assertThat(plan.getToolCalls()).extracting(ToolCall::getToolName).containsExactly("list_projects");
    }

    @Test
    void plan_noToolsNeeded_returnsDirectResponse() {
        when(llmClient.complete(anyString(), anyString(), any()))
                .thenReturn("{\"needsTools\": false, \"response\": \"2 + 2 = 4\"}");

        AgentPlan plan = planner.plan("What's 2+2", context);

        assertThat(plan.needsTools()).isFalse();
        assertThat(plan.getResponse()).isEqualTo("2 + 2 = 4");
        assertThat(plan.getPlan()).isEqualTo("Analyzing request: \"What's 2+2\"");
    }

    @Test
    void plan_proseReply_becomesDirectAnswer() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("Sure, happy to help with that.");

        AgentPlan plan = planner.plan("Hello", context);

        assertThat(plan.needsTools()).isFalse();
        assertThat(plan.getResponse()).isEqualTo("Sure, happy to help with that.");
    }

    @Test
    void plan_modelDown_researchRequestFallsBackToWebSearch() {
        when(llmClient.complete(anyString(), anyString(), any())).thenThrow(new ModelCallException("down"));

        AgentPlan plan = planner.plan("Research the history of typewriters", context);

        assertThat(plan.isFallback()).isTrue();
        assertThat(plan.getToolCalls()).singleElement().satisfies(call -> {
            assertThat(call.getToolName()).isEqualTo("web_search");
            assertThat(call.getArguments()).containsEntry("query", "Research the history of typewriters");
        });
    }

    @Test
    void plan_modelDown_vagueRequestAsksForClarification() {
        when(llmClient.complete(anyString(), anyString(), any())).thenThrow(new ModelCallException("down"));

        AgentPlan plan = planner.plan("What's 2+2", context);

        assertThat(plan.needsTools()).isFalse();
        assertThat(plan.getResponse()).isEqualTo(KeywordPlanner.CLARIFYING_RESPONSE);
    }

    @Test
    void plan_modelDown_statsRequestWithEditorContent_usesTextTools() {
        context.update(ContextUpdate.builder().currentDocumentId(1L).build());
        when(llmClient.complete(anyString(), anyString(), any())).thenThrow(new ModelCallException("down"));

        AgentPlan plan = planner.plan("Give me the word count and structure", context);

        assertThat(plan.getToolCalls()).extracting(ToolCall::getToolName)
                .containsExactly("analyze_document_stats", "analyze_document_structure");
    }
}
