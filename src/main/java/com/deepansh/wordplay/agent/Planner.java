package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.exception.ModelCallException;
import com.deepansh.wordplay.llm.CompletionOptions;
import com.deepansh.wordplay.llm.LlmClient;
import com.deepansh.wordplay.llm.ModelReplyParser;
import com.deepansh.wordplay.model.AgentPlan;
import com.deepansh.wordplay.model.ToolCall;
import com.deepansh.wordplay.tool.ToolDefinition;
import com.deepansh.wordplay.tool.ToolRegistry;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a natural-language request into an initial plan of tool calls.
 *
 * Never throws: an unparsable reply becomes a direct answer with no tools, and a failed
 * model call falls back to {@link KeywordPlanner}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Planner {

    private final LlmClient llmClient;
    private final ModelReplyParser replyParser;
    private final ToolRegistry toolRegistry;

    public AgentPlan plan(String request, ExecutionContext context) {
        String raw;
        try {
            raw = llmClient.complete(systemPrompt(context), request, CompletionOptions.builder()
                    .purpose("planner")
                    .model(context.getModelSelection())
                    .temperature(0.3)
                    .maxTokens(2000)
                    .jsonResponse(true)
                    .build());
        } catch (ModelCallException e) {
            log.warn("Planner model unavailable, using keyword plan [session={}]: {}",
                    context.getSessionId(), e.getMessage());
            return KeywordPlanner.plan(request, context);
        }

        return replyParser.parseObject(raw, PlannerReply.class)
                .map(reply -> toPlan(reply, request))
                .orElseGet(() -> {
                    log.warn("Planner reply was not JSON, answering directly [session={}]", context.getSessionId());
                    return AgentPlan.builder()
                            .plan(defaultPlanText(request))
                            .toolCalls(List.of())
                            .response(raw)
                            .build();
                });
    }

    private AgentPlan toPlan(PlannerReply reply, String request) {
        List<ToolCall> calls = new ArrayList<>();
        if (reply.toolCalls() != null) {
            for (ToolCall call : reply.toolCalls()) {
                if (call == null || call.getToolName() == null) {
                    continue;
                }
                if (!toolRegistry.hasTool(call.getToolName())) {
                    log.warn("Planner proposed unknown tool '{}', dropping it", call.getToolName());
                    continue;
                }
                if (call.getArguments() == null) {
                    call.setArguments(new HashMap<>());
                }
                calls.add(call);
            }
        }

        boolean wantsTools = reply.needsTools() == null || reply.needsTools();
        return AgentPlan.builder()
                .plan(reply.plan() != null && !reply.plan().isBlank() ? reply.plan() : defaultPlanText(request))
                .toolCalls(wantsTools ? calls : List.of())
                .response(reply.response())
                .build();
    }

    private String systemPrompt(ExecutionContext context) {
        String tools = toolRegistry.list().stream()
                .map(this::describeTool)
                .collect(Collectors.joining("\n"));

        return """
                You are an autonomous AI writing agent for the WordPlay writing assistant.
                You help users with research, document management and writing by calling tools.

                %s

                Available tools:
                %s

                Reply with a single JSON object:
                {
                  "needsTools": true or false,
                  "plan": "short description of your approach",
                  "toolCalls": [{"tool": "tool_name", "params": {...}, "reasoning": "why"}],
                  "response": "direct answer when no tools are needed"
                }
                Use only the tools listed above. Chain research and writing steps where useful.
                Questions you can answer directly need no tools."""
                .formatted(context.describe(), tools);
    }

    private String describeTool(ToolDefinition definition) {
        return "- " + definition.getName() + ": " + definition.getDescription()
                + " Parameters: " + replyParser.toJson(definition.getParameters());
    }

    static String defaultPlanText(String request) {
        return "Analyzing request: \"" + request + "\"";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlannerReply(Boolean needsTools,
                        String plan,
                        @JsonAlias("tool_calls") List<ToolCall> toolCalls,
                        String response) {
    }
}
