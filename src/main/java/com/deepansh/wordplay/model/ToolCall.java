package com.deepansh.wordplay.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * A tool invocation the agent intends to make, whether proposed by the planner,
 * the synthesizer or the chaining heuristics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolCall {

    @JsonAlias({"tool", "name"})
    private String toolName;

    @JsonAlias({"params", "parameters"})
    @Builder.Default
    private Map<String, Object> arguments = new HashMap<>();

    private String reasoning;

    public static ToolCall of(String toolName, Map<String, Object> arguments, String reasoning) {
        return new ToolCall(toolName, new HashMap<>(arguments), reasoning);
    }
}
