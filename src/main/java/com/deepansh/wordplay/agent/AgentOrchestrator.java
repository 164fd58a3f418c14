package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.config.AgentProperties;
import com.deepansh.wordplay.core.ContextSummary;
import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.core.SessionRegistry;
import com.deepansh.wordplay.model.AgentRequest;
import com.deepansh.wordplay.model.AgentResponse;
import com.deepansh.wordplay.model.AgentResponse.ExecutionDetails;
import com.deepansh.wordplay.model.AgentResponse.ToolExecutionSummary;
import com.deepansh.wordplay.model.AutonomySettings;
import com.deepansh.wordplay.model.GoalStatus;
import com.deepansh.wordplay.model.SynthesisResult;
import com.deepansh.wordplay.model.ToolExecution;
import com.deepansh.wordplay.model.ToolInvocationRequest;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.observability.RunContext;
import com.deepansh.wordplay.tool.ToolExecutor;
import com.deepansh.wordplay.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for agent requests: resolves the session, runs the autonomous loop and shapes
 * the outcome into a response.
 *
 * Requests against the same session are serialized; different sessions run concurrently.
 * An unexpected failure yields an apology narrative with no tool results instead of an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentOrchestrator {

    static final String DEFAULT_USER = "default";
    static final String APOLOGY = "I encountered an issue during autonomous execution. "
            + "The system attempted to complete your request but ran into technical difficulties. "
            + "Please try again with a more specific request or a lower autonomy level.";

    private final SessionRegistry sessionRegistry;
    private final AutonomousLoop autonomousLoop;
    private final ToolExecutor toolExecutor;
    private final ToolRegistry toolRegistry;
    private final AgentProperties agentProperties;

    public AgentResponse handle(AgentRequest request) {
        String userId = request.getUserId() != null ? request.getUserId() : DEFAULT_USER;
        ExecutionContext context = sessionRegistry.open(request.getSessionId(), userId);

        synchronized (context) {
            AutonomySettings settings = agentProperties.settingsFor(request.getAutonomyLevel());
            if (request.getReflectionEnabled() != null) {
                settings = settings.toBuilder().reflectionEnabled(request.getReflectionEnabled()).build();
            }
            context.setAutonomy(settings);

            long budgetMs = request.getMaxExecutionTimeMs() != null
                    ? request.getMaxExecutionTimeMs()
                    : agentProperties.getMaxExecutionTimeMs();

            log.info("Agent request started [session={}, user={}, autonomy={}, request='{}']",
                    context.getSessionId(), userId, settings.getLevel(), request.getRequest());

            RunContext runCtx = new RunContext();
            try {
                context.update(request.getContext());
                LoopOutcome outcome = autonomousLoop.run(request.getRequest(), context, budgetMs, runCtx);
                closeGoal(outcome, context);
                AgentResponse response = buildResponse(outcome, context, settings, runCtx);
                recordExecution(request.getRequest(), response, context);

                log.info("Agent request complete [session={}, tools={}, iterations={}, stop={}, latency={}ms]",
                        context.getSessionId(), outcome.getExecutions().size(), outcome.getIterations(),
                        outcome.getStopReason().getDescription(), runCtx.elapsedMs());
                return response;
            } catch (Exception e) {
                log.error("Agent request failed [session={}]", context.getSessionId(), e);
                return AgentResponse.builder()
                        .sessionId(context.getSessionId())
                        .plan("Error occurred during autonomous processing")
                        .narrative(APOLOGY)
                        .suggestedActions(new ArrayList<>(List.of(
                                "Try a simpler request",
                                "Check your connection",
                                "Use a lower autonomy level")))
                        .executionDetails(ExecutionDetails.builder()
                                .maxIterations(settings.getMaxIterations())
                                .durationMs(runCtx.elapsedMs())
                                .autonomyLevel(settings.getLevel())
                                .stopReason("error")
                                .modelFallbacks(runCtx.modelFallbackCount())
                                .build())
                        .build();
            }
        }
    }

    /** Runs one tool against a session's context without planning or chaining. */
    public ToolResult executeTool(ToolInvocationRequest request) {
        String userId = request.getUserId() != null ? request.getUserId() : DEFAULT_USER;
        ExecutionContext context = sessionRegistry.open(request.getSessionId(), userId);
        synchronized (context) {
            context.update(request.getContext());
            String reasoning = request.getReasoning() != null ? request.getReasoning() : "Direct tool invocation";
            return toolExecutor.execute(request.getTool(), request.getParameters(), reasoning, context);
        }
    }

    public ContextSummary contextSummary(String sessionId) {
        ExecutionContext context = sessionRegistry.require(sessionId);
        synchronized (context) {
            return context.summary(toolRegistry.names());
        }
    }

    public void closeSession(String sessionId) {
        sessionRegistry.close(sessionId);
    }

    private void closeGoal(LoopOutcome outcome, ExecutionContext context) {
        if (outcome.getGoal() == null || outcome.getGoal().getStatus().isTerminal()) {
            return;
        }
        boolean answered = outcome.getExecutions().isEmpty() || outcome.successfulCount() > 0;
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("goalId", outcome.getGoal().getId());
        params.put("status", (answered ? GoalStatus.COMPLETED : GoalStatus.FAILED).wireName());
        params.put("notes", outcome.getExecutions().isEmpty()
                ? "Answered without tools"
                : "Executed " + outcome.getExecutions().size() + " tools, "
                        + outcome.successfulCount() + " successful");
        toolExecutor.execute("update_goal_status", params, "Closing the request's goal", context);
    }

    private void recordExecution(String request, AgentResponse response, ExecutionContext context) {
        ExecutionDetails details = response.getExecutionDetails();
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("request", request);
        value.put("toolsExecuted", details.getToolsExecuted());
        value.put("successRate", details.getSuccessRate());
        value.put("iterations", details.getIterations());
        value.put("durationMs", details.getDurationMs());
        value.put("stopReason", details.getStopReason());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("key", "execution_" + System.currentTimeMillis());
        params.put("value", value);
        params.put("category", "execution_history");
        toolExecutor.execute("store_memory", params, "Recording execution history", context);
    }

    private AgentResponse buildResponse(LoopOutcome outcome, ExecutionContext context,
                                        AutonomySettings settings, RunContext runCtx) {
        List<ToolExecution> executions = outcome.getExecutions();
        SynthesisResult synthesis = outcome.getSynthesis();

        int successful = (int) outcome.successfulCount();
        long averageMs = executions.isEmpty() ? 0 : Math.round(executions.stream()
                .mapToLong(e -> e.getResult().getExecutionTimeMs())
                .average()
                .orElse(0));

        ExecutionDetails details = ExecutionDetails.builder()
                .toolsPlanned(outcome.getPlan().getToolCalls().size())
                .toolsExecuted(executions.size())
                .successfulTools(successful)
                .failedTools(executions.size() - successful)
                .successRate(ContinuationPolicy.successRate(executions))
                .averageToolTimeMs(averageMs)
                .iterations(outcome.getIterations())
                .maxIterations(settings.getMaxIterations())
                .durationMs(runCtx.elapsedMs())
                .autonomyLevel(settings.getLevel())
                .stopReason(outcome.getStopReason().getDescription())
                .reflectionsPerformed(runCtx.getReflections())
                .modelFallbacks(runCtx.modelFallbackCount())
                .build();

        AgentResponse.AgentResponseBuilder builder = AgentResponse.builder()
                .sessionId(context.getSessionId())
                .plan(outcome.getPlan().getPlan())
                .toolsExecuted(new ArrayList<>(executions.stream().map(ToolExecutionSummary::from).toList()))
                .executionDetails(details)
                .executionLog(new ArrayList<>(outcome.getExecutionLog()))
                .editorState(context.getEditorState());

        if (synthesis == null) {
            String answer = outcome.getPlan().getResponse();
            return builder
                    .narrative(answer != null && !answer.isBlank() ? answer : KeywordPlanner.CLARIFYING_RESPONSE)
                    .build();
        }
        return builder
                .narrative(synthesis.getNarrative())
                .suggestedActions(new ArrayList<>(synthesis.getSuggestedActions()))
                .continuousOperationPlan(synthesis.getContinuousOperationPlan())
                .researchFindings(new ArrayList<>(synthesis.getResearchFindings()))
                .build();
    }
}
