package com.deepansh.wordplay.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a call does not satisfy the tool's parameter schema.
 * The tool body is never invoked for such a call.
 */
@Getter
public class InvalidToolArgumentsException extends AgentException {

    private final String toolName;
    private final List<String> violations;

    public InvalidToolArgumentsException(String toolName, List<String> violations) {
        super("Invalid arguments for '" + toolName + "': " + String.join("; ", violations));
        this.toolName = toolName;
        this.violations = List.copyOf(violations);
    }
}
