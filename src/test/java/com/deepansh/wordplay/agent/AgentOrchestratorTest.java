package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.config.AgentProperties;
import com.deepansh.wordplay.config.ToolProperties;
import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.core.SessionRegistry;
import com.deepansh.wordplay.exception.ModelCallException;
import com.deepansh.wordplay.llm.LlmClient;
import com.deepansh.wordplay.llm.ModelReplyParser;
import com.deepansh.wordplay.model.AgentRequest;
import com.deepansh.wordplay.model.AgentResponse;
import com.deepansh.wordplay.model.AgentResponse.ToolExecutionSummary;
import com.deepansh.wordplay.model.AutonomyLevel;
import com.deepansh.wordplay.model.ContextUpdate;
import com.deepansh.wordplay.model.GoalStatus;
import com.deepansh.wordplay.model.ToolInvocationRequest;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.persistence.InMemoryWritingStore;
import com.deepansh.wordplay.research.ScrapedPage;
import com.deepansh.wordplay.research.SearchResult;
import com.deepansh.wordplay.research.SearchResults;
import com.deepansh.wordplay.research.WebResearchClient;
import com.deepansh.wordplay.tool.ToolExecutor;
import com.deepansh.wordplay.tool.ToolFixtures;
import com.deepansh.wordplay.tool.ToolRegistry;
import com.deepansh.wordplay.writing.WritingAssistant;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end runs of the orchestrator over real components, with a scripted model and a
 * mocked research client.
 */
class AgentOrchestratorTest {

    private static final String TASK_DONE = "{\"narrative\": \"All done.\", \"additionalToolCalls\": []}";

    private String plannerReply;
    private final Deque<String> synthesisReplies = new ArrayDeque<>();
    private boolean modelDown;
    private long plannerDelayMs;

    private WebResearchClient researchClient;
    private SessionRegistry sessionRegistry;
    private AgentProperties agentProperties;
    private AgentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        InMemoryWritingStore store = new InMemoryWritingStore();
        ModelReplyParser parser = new ModelReplyParser(new ObjectMapper());
        LlmClient llmClient = (system, user, options) -> {
            if (modelDown) {
                throw new ModelCallException("provider unavailable");
            }
            return switch (options.getPurpose()) {
                case "planner" -> {
                    pause(plannerDelayMs);
                    yield plannerReply;
                }
                case "synthesizer" -> synthesisReplies.isEmpty() ? TASK_DONE : synthesisReplies.poll();
                case "reflector" -> "{\"analysis\": \"Going well\"}";
                default -> "{}";
            };
        };

        researchClient = mock(WebResearchClient.class);
        agentProperties = new AgentProperties();
        ToolRegistry registry = new ToolRegistry(ToolFixtures.allTools(store,
                new WritingAssistant(llmClient, parser), researchClient));
        ToolExecutor executor = new ToolExecutor(registry);
        sessionRegistry = new SessionRegistry(store, agentProperties);

        AutonomousLoop loop = new AutonomousLoop(
                new Planner(llmClient, parser, registry),
                executor,
                new ChainingHeuristics(new ToolProperties()),
                new Synthesizer(llmClient, parser, registry, new TemplateSynthesizer(registry)),
                new Reflector(llmClient, parser, agentProperties),
                new ContinuationPolicy(),
                agentProperties);
        orchestrator = new AgentOrchestrator(sessionRegistry, loop, executor, registry, agentProperties);
    }

    private static void pause(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void stubResearch() {
        when(researchClient.search(anyString(), anyString())).thenReturn(new SearchResults(List.of(
                new SearchResult("Typewriter history", "Invented in 1868", "https://a.example/history"),
                new SearchResult("Collecting typewriters", "Vintage", "https://b.example/collect"),
                new SearchResult("Typewriter museum", "Exhibits", "https://c.example/museum")), "summary", null));
        when(researchClient.scrape(anyString())).thenReturn(new ScrapedPage(
                "Typewriter history", "The first commercially successful typewriter ".repeat(20), 120, "a.example"));
    }

    private AgentRequest.AgentRequestBuilder request(String text) {
        return AgentRequest.builder().request(text).sessionId("s-" + text.hashCode());
    }

    @Test
    void handle_directQuestion_answersWithoutTools() {
        plannerReply = "{\"needsTools\": false, \"plan\": \"Answer directly\", \"response\": \"2 + 2 = 4\"}";

        AgentResponse response = orchestrator.handle(request("What's 2+2").build());

        assertThat(response.getNarrative()).isEqualTo("2 + 2 = 4");
        assertThat(response.getToolsExecuted()).isEmpty();
        assertThat(response.getExecutionDetails().getStopReason()).isEqualTo("no tools required");
        assertThat(response.getExecutionDetails().getIterations()).isZero();

        ExecutionContext context = sessionRegistry.require(response.getSessionId());
        assertThat(context.getCurrentGoals()).singleElement()
                .satisfies(goal -> assertThat(goal.getStatus()).isEqualTo(GoalStatus.COMPLETED));
        assertThat(context.getPersistentMemory().values())
                .anySatisfy(entry -> assertThat(entry.getCategory()).isEqualTo("execution_history"));
    }

    @Test
    void handle_researchWithActiveProject_chainsScrapeAndSaveSource() {
        stubResearch();
        plannerReply = """
                {"needsTools": true, "plan": "Research typewriters",
                 "toolCalls": [{"tool": "web_search", "params": {"query": "typewriter history"},
                                "reasoning": "Need background"}]}""";

        AgentResponse response = orchestrator.handle(request("Research typewriters")
                .context(ContextUpdate.builder().currentProjectId(1L).build())
                .build());

        assertThat(response.getToolsExecuted()).extracting(ToolExecutionSummary::getTool)
                .containsExactly("web_search", "scrape_webpage", "save_source");
        assertThat(response.getToolsExecuted()).extracting(ToolExecutionSummary::isChained)
                .containsExactly(false, true, true);
        assertThat(response.getToolsExecuted().get(1).getReasoning()).startsWith("Auto-chained from web_search:");
        assertThat(response.getToolsExecuted().get(2).getParameters())
                .containsEntry("name", "Typewriter history")
                .containsEntry("url", "https://a.example/history");

        assertThat(response.getContinuousOperationPlan().getNextPhase()).isEqualTo("Content Creation");
        assertThat(response.getResearchFindings()).hasSize(3);
        assertThat(response.getResearchFindings().get(0).getExcerpt()).isNotBlank();
        assertThat(response.getNarrative()).isEqualTo("All done.");
        assertThat(response.getExecutionDetails().getSuccessRate()).isEqualTo(1.0);
        assertThat(response.getExecutionDetails().getStopReason()).isEqualTo("task complete");

        ExecutionContext context = sessionRegistry.require(response.getSessionId());
        assertThat(context.getProjectSources()).hasSize(1);
    }

    @Test
    void handle_modelOutage_usesKeywordPlanAndTemplateNarrative() {
        stubResearch();
        modelDown = true;

        AgentResponse response = orchestrator.handle(request("Research the history of typewriters").build());

        assertThat(response.getToolsExecuted()).extracting(ToolExecutionSummary::getTool)
                .containsExactly("web_search", "scrape_webpage");
        assertThat(response.getNarrative()).startsWith("I completed 2 of 2 operations");
        assertThat(response.getExecutionDetails().getSuccessRate()).isEqualTo(1.0);
        assertThat(response.getExecutionDetails().getModelFallbacks()).isGreaterThanOrEqualTo(3);
        assertThat(response.getContinuousOperationPlan()).isNotNull();
    }

    @Test
    void handle_modelOutageWithVagueRequest_returnsClarifyingAnswer() {
        modelDown = true;

        AgentResponse response = orchestrator.handle(request("What's 2+2").build());

        assertThat(response.getNarrative()).isEqualTo(KeywordPlanner.CLARIFYING_RESPONSE);
        assertThat(response.getToolsExecuted()).isEmpty();
        assertThat(response.getExecutionDetails().getSuccessRate()).isZero();
    }

    @Test
    void handle_synthesisProposesMore_runsSecondIteration() {
        plannerReply = "{\"toolCalls\": [{\"tool\": \"list_projects\"}]}";
        synthesisReplies.add("""
                {"narrative": "Listed projects.",
                 "additionalToolCalls": [{"tool": "get_project", "params": {"projectId": 1}}]}""");

        AgentResponse response = orchestrator.handle(request("Show my novel project").build());

        assertThat(response.getExecutionDetails().getIterations()).isEqualTo(2);
        assertThat(response.getToolsExecuted()).extracting(ToolExecutionSummary::getTool)
                .containsExactly("list_projects", "get_project");
        assertThat(response.getExecutionLog()).extracting(AgentResponse.IterationLogEntry::getPhase)
                .containsExactly("planning", "execution", "execution");
    }

    @Test
    void handle_conservative_capsToolChainLength() {
        plannerReply = """
                {"toolCalls": [
                  {"tool": "list_projects"}, {"tool": "list_projects"}, {"tool": "list_projects"},
                  {"tool": "list_projects"}, {"tool": "list_projects"}, {"tool": "list_projects"},
                  {"tool": "list_projects"}]}""";

        AgentResponse response = orchestrator.handle(request("List everything")
                .autonomyLevel(AutonomyLevel.CONSERVATIVE)
                .build());

        assertThat(response.getToolsExecuted()).hasSize(5);
        assertThat(response.getExecutionDetails().getToolsPlanned()).isEqualTo(7);
        assertThat(response.getExecutionDetails().getMaxIterations()).isEqualTo(10);
        assertThat(response.getExecutionDetails().getAutonomyLevel()).isEqualTo(AutonomyLevel.CONSERVATIVE);
    }

    @Test
    void handle_reflectionEnabled_reflectsEveryFiveExecutions() {
        plannerReply = """
                {"toolCalls": [
                  {"tool": "list_projects"}, {"tool": "list_projects"}, {"tool": "list_projects"},
                  {"tool": "list_projects"}, {"tool": "list_projects"}]}""";

        AgentResponse response = orchestrator.handle(request("List five times").build());

        assertThat(response.getExecutionDetails().getReflectionsPerformed()).isEqualTo(1);
        assertThat(sessionRegistry.require(response.getSessionId()).getReflections()).hasSize(1);
    }

    @Test
    void handle_aggressive_skipsReflectionUnlessRequested() {
        plannerReply = """
                {"toolCalls": [
                  {"tool": "list_projects"}, {"tool": "list_projects"}, {"tool": "list_projects"},
                  {"tool": "list_projects"}, {"tool": "list_projects"}]}""";

        AgentResponse silent = orchestrator.handle(request("Aggressive run")
                .autonomyLevel(AutonomyLevel.AGGRESSIVE).build());
        AgentResponse reflective = orchestrator.handle(request("Aggressive reflective run")
                .autonomyLevel(AutonomyLevel.AGGRESSIVE).reflectionEnabled(true).build());

        assertThat(silent.getExecutionDetails().getReflectionsPerformed()).isZero();
        assertThat(reflective.getExecutionDetails().getReflectionsPerformed()).isEqualTo(1);
    }

    @Test
    void handle_timeBudgetExhausted_stopsAfterIteration() {
        plannerReply = "{\"toolCalls\": [{\"tool\": \"list_projects\"}]}";
        plannerDelayMs = 20;
        for (int i = 0; i < 10; i++) {
            synthesisReplies.add("{\"narrative\": \"More\", \"additionalToolCalls\": [{\"tool\": \"list_projects\"}]}");
        }

        AgentResponse response = orchestrator.handle(request("Keep listing")
                .maxExecutionTimeMs(1L)
                .build());

        assertThat(response.getExecutionDetails().getStopReason()).isEqualTo("time budget exceeded");
        assertThat(response.getExecutionDetails().getIterations()).isEqualTo(1);
        assertThat(response.getToolsExecuted()).hasSize(1);
    }

    @Test
    void handle_allToolsFail_marksGoalFailed() {
        plannerReply = "{\"toolCalls\": [{\"tool\": \"get_document\", \"params\": {\"documentId\": 999}}]}";

        AgentResponse response = orchestrator.handle(request("Open document 999").build());

        assertThat(response.getExecutionDetails().getFailedTools()).isEqualTo(1);
        assertThat(response.getExecutionDetails().getStopReason()).isEqualTo("low success rate");
        assertThat(sessionRegistry.require(response.getSessionId()).getCurrentGoals())
                .singleElement()
                .satisfies(goal -> assertThat(goal.getStatus()).isEqualTo(GoalStatus.FAILED));
    }

    @Test
    void handle_unexpectedFailure_returnsApologyWithoutTools() {
        AutonomousLoop failingLoop = mock(AutonomousLoop.class);
        when(failingLoop.run(anyString(), any(), anyLong(), any())).thenThrow(new IllegalStateException("bug"));
        AgentOrchestrator failing = new AgentOrchestrator(sessionRegistry, failingLoop,
                mock(ToolExecutor.class), mock(ToolRegistry.class), agentProperties);

        AgentResponse response = failing.handle(request("Anything").build());

        assertThat(response.getNarrative()).isEqualTo(AgentOrchestrator.APOLOGY);
        assertThat(response.getToolsExecuted()).isEmpty();
        assertThat(response.getExecutionDetails().getStopReason()).isEqualTo("error");
    }

    @Test
    void executeTool_runsAgainstSessionContext() {
        ToolResult result = orchestrator.executeTool(ToolInvocationRequest.builder()
                .sessionId("direct")
                .tool("store_memory")
                .parameters(Map.of("key", "tone", "value", "warm"))
                .build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(orchestrator.contextSummary("direct").memoryKeys()).containsExactly("tone");
    }
}
