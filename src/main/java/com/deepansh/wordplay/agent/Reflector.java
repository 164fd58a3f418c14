package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.config.AgentProperties;
import com.deepansh.wordplay.exception.ModelCallException;
import com.deepansh.wordplay.llm.CompletionOptions;
import com.deepansh.wordplay.llm.LlmClient;
import com.deepansh.wordplay.llm.ModelReplyParser;
import com.deepansh.wordplay.model.ExecutionStep;
import com.deepansh.wordplay.model.Goal;
import com.deepansh.wordplay.model.Reflection;
import com.deepansh.wordplay.tool.ToolExecutor;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Periodic self-assessment of recent execution history.
 * Advisory only: the result is recorded on the context and never alters control flow.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Reflector {

    static final String FALLBACK_ANALYSIS = "Reflection unavailable, continue with current approach";

    private final LlmClient llmClient;
    private final ModelReplyParser replyParser;
    private final AgentProperties agentProperties;

    /**
     * Scores the trailing result steps of {@code history} and asks the model what to adjust.
     * Never throws.
     */
    public Reflection reflect(Goal goal, List<ExecutionStep> history, String model) {
        List<ExecutionStep> recent = recentResults(history);
        double successRate = recent.isEmpty()
                ? 0.0
                : (double) recent.stream().filter(ExecutionStep::isSuccess).count() / recent.size();

        String system = """
                You are reflecting on an autonomous writing agent's recent tool executions.
                Reply with a JSON object:
                {"analysis": string, "improvements": [string], "toolRecommendations": [string],
                 "strategyAdjustments": [string]}""";

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("goal", goal != null ? goal.getDescription() : null);
        input.put("successRate", successRate);
        input.put("recentActions", recent.stream()
                .map(step -> Map.of(
                        "tool", String.valueOf(step.getToolUsed()),
                        "success", step.isSuccess(),
                        "outcome", step.getResult() != null ? step.getResult().describe() : ""))
                .toList());

        try {
            String raw = llmClient.complete(system, replyParser.toJson(input), CompletionOptions.builder()
                    .purpose("reflector")
                    .model(model)
                    .temperature(0.4)
                    .jsonResponse(true)
                    .build());
            return replyParser.parseObject(raw, ReflectionReply.class)
                    .map(reply -> Reflection.builder()
                            .analysis(reply.analysis() != null ? reply.analysis() : "")
                            .improvements(orEmpty(reply.improvements()))
                            .toolRecommendations(orEmpty(reply.toolRecommendations()))
                            .strategyAdjustments(orEmpty(reply.strategyAdjustments()))
                            .successRate(successRate)
                            .timestamp(Instant.now())
                            .build())
                    .orElseGet(() -> fallback(successRate));
        } catch (ModelCallException e) {
            log.warn("Reflection model call failed: {}", e.getMessage());
            return fallback(successRate);
        }
    }

    private List<ExecutionStep> recentResults(List<ExecutionStep> history) {
        if (history == null) {
            return List.of();
        }
        List<ExecutionStep> results = history.stream()
                .filter(step -> ToolExecutor.ACTION_RESULT.equals(step.getAction()))
                .toList();
        int window = agentProperties.getReflectionWindow();
        return results.subList(Math.max(0, results.size() - window), results.size());
    }

    private Reflection fallback(double successRate) {
        return Reflection.builder()
                .analysis(FALLBACK_ANALYSIS)
                .successRate(successRate)
                .fallback(true)
                .timestamp(Instant.now())
                .build();
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ReflectionReply(String analysis,
                           List<String> improvements,
                           List<String> toolRecommendations,
                           List<String> strategyAdjustments) {
    }
}
