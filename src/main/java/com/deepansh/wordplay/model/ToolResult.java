package com.deepansh.wordplay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a single tool invocation.
 *
 * Tool bodies build results through {@link #ok} / {@link #failure}; the executor stamps
 * {@code tool} and {@code executionTimeMs} via {@link #timed} before the result leaves it.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResult {

    boolean success;
    Object data;
    String error;
    String message;
    String tool;
    long executionTimeMs;

    public static ToolResult ok(Object data, String message) {
        return ToolResult.builder().success(true).data(data).message(message).build();
    }

    public static ToolResult failure(String error) {
        return ToolResult.builder().success(false).error(error).build();
    }

    public ToolResult timed(String toolName, long elapsedMs) {
        return toBuilder()
                .tool(toolName)
                .executionTimeMs(Math.max(0, elapsedMs))
                .build();
    }

    /** Short human-readable outcome: the message on success, the error otherwise. */
    public String describe() {
        if (success) {
            return message != null ? message : "Executed successfully";
        }
        return error != null ? error : "Failed";
    }
}
