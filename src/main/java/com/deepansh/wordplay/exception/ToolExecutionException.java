package com.deepansh.wordplay.exception;

import lombok.Getter;

/**
 * Wraps a failure raised inside a tool body. The executor converts it into a failed
 * ToolResult; it never reaches the loop.
 */
@Getter
public class ToolExecutionException extends AgentException {

    private final String toolName;

    public ToolExecutionException(String toolName, Throwable cause) {
        super(describe(cause), cause);
        this.toolName = toolName;
    }

    public ToolExecutionException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }
}
