package com.deepansh.wordplay.tool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema sent to the model and the tools endpoint.
 * Decouples the serialization format from the AgentTool implementation.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    ToolCategory category;
    Map<String, Object> parameters;

    public static ToolDefinition from(AgentTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription().strip())
                .category(tool.getCategory())
                .parameters(tool.getParameters().toJsonSchema())
                .build();
    }
}
