package com.deepansh.wordplay.exception;

import lombok.Getter;

@Getter
public class UnknownToolException extends AgentException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Tool '" + toolName + "' not found");
        this.toolName = toolName;
    }
}
