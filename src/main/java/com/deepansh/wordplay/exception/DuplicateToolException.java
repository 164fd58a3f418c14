package com.deepansh.wordplay.exception;

import lombok.Getter;

@Getter
public class DuplicateToolException extends AgentException {

    private final String toolName;

    public DuplicateToolException(String toolName) {
        super("Tool '" + toolName + "' is already registered");
        this.toolName = toolName;
    }
}
