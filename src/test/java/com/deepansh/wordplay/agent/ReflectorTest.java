package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.config.AgentProperties;
import com.deepansh.wordplay.exception.ModelCallException;
import com.deepansh.wordplay.llm.LlmClient;
import com.deepansh.wordplay.llm.ModelReplyParser;
import com.deepansh.wordplay.model.ExecutionStep;
import com.deepansh.wordplay.model.Goal;
import com.deepansh.wordplay.model.Reflection;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.tool.ToolExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReflectorTest {

    @Mock LlmClient llmClient;

    private Reflector reflector;
    private final Goal goal = new Goal("Write an essay", 1, List.of(), 4);

    @BeforeEach
    void setUp() {
        reflector = new Reflector(llmClient, new ModelReplyParser(new ObjectMapper()), new AgentProperties());
    }

    private static List<ExecutionStep> history(int successes, int failures) {
        List<ExecutionStep> steps = new ArrayList<>();
        for (int i = 0; i < successes + failures; i++) {
            boolean ok = i < successes;
            steps.add(ExecutionStep.builder().action(ToolExecutor.ACTION_ATTEMPTED).toolUsed("t").build());
            steps.add(ExecutionStep.builder()
                    .action(ToolExecutor.ACTION_RESULT)
                    .toolUsed("t")
                    .success(ok)
                    .result(ok ? ToolResult.ok(null, "ok") : ToolResult.failure("no"))
                    .build());
        }
        return steps;
    }

    @Test
    void reflect_modelReply_parsedWithComputedSuccessRate() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("""
                {"analysis": "Searches work, scraping fails",
                 "improvements": ["Prefer primary sources"],
                 "toolRecommendations": ["save_source"]}""");

        Reflection reflection = reflector.reflect(goal, history(3, 1), null);

        assertThat(reflection.isFallback()).isFalse();
        assertThat(reflection.getAnalysis()).isEqualTo("Searches work, scraping fails");
        assertThat(reflection.getToolRecommendations()).containsExactly("save_source");
        assertThat(reflection.getStrategyAdjustments()).isEmpty();
        assertThat(reflection.getSuccessRate()).isEqualTo(0.75);
    }

    @Test
    void reflect_scoresOnlyTrailingWindowOfResults() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("{\"analysis\": \"ok\"}");

        List<ExecutionStep> steps = new ArrayList<>(history(0, 5));
        steps.addAll(history(10, 0));

        assertThat(reflector.reflect(goal, steps, null).getSuccessRate()).isEqualTo(1.0);
    }

    @Test
    void reflect_modelDown_returnsFallback() {
        when(llmClient.complete(anyString(), anyString(), any())).thenThrow(new ModelCallException("down"));

        Reflection reflection = reflector.reflect(goal, history(1, 1), null);

        assertThat(reflection.isFallback()).isTrue();
        assertThat(reflection.getAnalysis()).contains("continue with current approach");
        assertThat(reflection.getSuccessRate()).isEqualTo(0.5);
    }

    @Test
    void reflect_unparsableReply_returnsFallback() {
        when(llmClient.complete(anyString(), anyString(), any())).thenReturn("I think it went fine");

        assertThat(reflector.reflect(goal, history(1, 0), null).isFallback()).isTrue();
    }
}
