package com.deepansh.wordplay.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** The planner's structured answer for a request. */
@Value
@Builder
public class AgentPlan {

    String plan;
    @Builder.Default
    List<ToolCall> toolCalls = List.of();
    String response;
    boolean fallback;

    public boolean needsTools() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
