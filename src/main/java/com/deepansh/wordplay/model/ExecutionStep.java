package com.deepansh.wordplay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable entry of the session's execution history.
 * The executor writes two per tool attempt: an "attempted" step and a "result" step.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionStep {

    String id;
    Instant timestamp;
    String action;
    String toolUsed;
    Map<String, Object> parameters;
    ToolResult result;
    boolean success;
    String reasoning;
}
