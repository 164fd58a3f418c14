package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.llm.CompletionOptions;
import com.deepansh.wordplay.llm.LlmClient;
import com.deepansh.wordplay.llm.ModelReplyParser;
import com.deepansh.wordplay.model.SynthesisResult;
import com.deepansh.wordplay.model.ToolCall;
import com.deepansh.wordplay.model.ToolExecution;
import com.deepansh.wordplay.tool.ToolRegistry;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summarizes tool executions into a narrative and proposes follow-up calls.
 *
 * Two tiers: the model writes the narrative and may propose additional calls; when it is
 * unavailable or replies with something unusable, {@link TemplateSynthesizer} takes over.
 * Never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Synthesizer {

    private static final int MAX_DATA_CHARS = 1500;

    private final LlmClient llmClient;
    private final ModelReplyParser replyParser;
    private final ToolRegistry toolRegistry;
    private final TemplateSynthesizer templateSynthesizer;

    public SynthesisResult synthesize(String request, List<ToolExecution> executions, String model) {
        SynthesisResult template = templateSynthesizer.synthesize(request, executions);
        try {
            String raw = llmClient.complete(systemPrompt(), userPrompt(request, executions),
                    CompletionOptions.builder()
                            .purpose("synthesizer")
                            .model(model)
                            .temperature(0.5)
                            .maxTokens(1500)
                            .jsonResponse(true)
                            .build());

            SynthesisReply reply = replyParser.parseObject(raw, SynthesisReply.class).orElse(null);
            if (reply == null || reply.narrative() == null || reply.narrative().isBlank()) {
                log.warn("Synthesis reply unusable, using template narrative");
                return template;
            }

            return template.toBuilder()
                    .narrative(reply.narrative())
                    .suggestedActions(reply.suggestedActions() != null && !reply.suggestedActions().isEmpty()
                            ? reply.suggestedActions()
                            : template.getSuggestedActions())
                    .additionalToolCalls(knownCalls(reply.additionalToolCalls()))
                    .fallback(false)
                    .build();
        } catch (Exception e) {
            log.warn("Synthesis model call failed, using template narrative: {}", e.getMessage());
            return template;
        }
    }

    private List<ToolCall> knownCalls(List<ToolCall> proposed) {
        if (proposed == null) {
            return List.of();
        }
        return proposed.stream()
                .filter(Objects::nonNull)
                .filter(call -> {
                    boolean known = call.getToolName() != null && toolRegistry.hasTool(call.getToolName());
                    if (!known) {
                        log.warn("Synthesis proposed unknown tool '{}', dropping it", call.getToolName());
                    }
                    return known;
                })
                .peek(call -> {
                    if (call.getArguments() == null) {
                        call.setArguments(new HashMap<>());
                    }
                })
                .toList();
    }

    private String systemPrompt() {
        return """
                You are synthesizing the results of an autonomous writing agent's tool executions.
                Write a concise, helpful narrative for the user covering what was done and found.
                Only propose additional tool calls when they clearly move the request forward.
                Available tools: %s
                Reply with a JSON object:
                {"narrative": string, "suggestedActions": [string],
                 "additionalToolCalls": [{"tool": string, "params": object, "reasoning": string}]}"""
                .formatted(String.join(", ", toolRegistry.names()));
    }

    private String userPrompt(String request, List<ToolExecution> executions) {
        List<Map<String, Object>> results = executions.stream().map(execution -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("tool", execution.getToolName());
            entry.put("params", execution.getParameters());
            entry.put("success", execution.isSuccess());
            if (execution.isSuccess()) {
                String data = replyParser.toJson(execution.getResult().getData());
                entry.put("data", data.length() > MAX_DATA_CHARS ? data.substring(0, MAX_DATA_CHARS) + "..." : data);
            } else {
                entry.put("error", execution.getResult().describe());
            }
            return entry;
        }).toList();

        return "Original request: " + request + "\n\nTool results:\n" + replyParser.toJson(results);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SynthesisReply(@JsonAlias("response") String narrative,
                          List<String> suggestedActions,
                          @JsonAlias({"additional_tool_calls", "toolCalls"}) List<ToolCall> additionalToolCalls) {
    }
}
