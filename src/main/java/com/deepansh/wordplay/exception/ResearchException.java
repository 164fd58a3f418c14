package com.deepansh.wordplay.exception;

public class ResearchException extends AgentException {

    public ResearchException(String message) {
        super(message);
    }

    public ResearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
