package com.deepansh.wordplay.tool;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.exception.InvalidToolArgumentsException;
import com.deepansh.wordplay.exception.ToolExecutionException;
import com.deepansh.wordplay.exception.UnknownToolException;
import com.deepansh.wordplay.model.ExecutionStep;
import com.deepansh.wordplay.model.Goal;
import com.deepansh.wordplay.model.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one named tool against a session context.
 *
 * Never throws for tool-level problems: unknown names, schema violations and exceptions
 * from tool bodies all come back as failed results. Every call appends exactly two history
 * steps ("attempted" before, "result" after) and every result carries the tool name and
 * elapsed time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolExecutor {

    public static final String ACTION_ATTEMPTED = "attempted";
    public static final String ACTION_RESULT = "result";

    private final ToolRegistry toolRegistry;

    public ToolResult execute(String toolName, Map<String, Object> params, String reasoning,
                              ExecutionContext context) {
        Map<String, Object> arguments = params != null ? new LinkedHashMap<>(params) : new LinkedHashMap<>();

        context.recordStep(step(ACTION_ATTEMPTED, toolName, arguments, null, false, reasoning));
        log.info("Executing tool: [{}] with args: {} [session={}]", toolName, arguments, context.getSessionId());

        long start = System.nanoTime();
        ToolResult result;
        try {
            AgentTool tool = toolRegistry.get(toolName);
            ToolArguments bound = tool.getParameters().bind(toolName, arguments);
            result = tool.execute(bound, context);
            if (result == null) {
                result = ToolResult.failure("Tool returned no result");
            }
        } catch (UnknownToolException | InvalidToolArgumentsException e) {
            log.warn("Rejected call to [{}]: {}", toolName, e.getMessage());
            result = ToolResult.failure(e.getMessage());
        } catch (Exception e) {
            ToolExecutionException failure = new ToolExecutionException(toolName, e);
            log.error("Unexpected error in tool [{}]", toolName, failure);
            result = ToolResult.failure(failure.getMessage());
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        result = result.timed(toolName, elapsedMs);

        context.recordStep(step(ACTION_RESULT, toolName, arguments, result, result.isSuccess(), reasoning));
        context.activeGoal().ifPresent(Goal::recordStep);

        if (result.isSuccess()) {
            log.info("Tool [{}] succeeded in {}ms: {}", toolName, elapsedMs, result.describe());
        } else {
            log.info("Tool [{}] failed in {}ms: {}", toolName, elapsedMs, result.describe());
        }
        return result;
    }

    private ExecutionStep step(String action, String toolName, Map<String, Object> arguments,
                               ToolResult result, boolean success, String reasoning) {
        return ExecutionStep.builder()
                .id("step_" + UUID.randomUUID().toString().substring(0, 8))
                .timestamp(Instant.now())
                .action(action)
                .toolUsed(toolName)
                .parameters(Collections.unmodifiableMap(new LinkedHashMap<>(arguments)))
                .result(result)
                .success(success)
                .reasoning(reasoning != null ? reasoning : "")
                .build();
    }
}
