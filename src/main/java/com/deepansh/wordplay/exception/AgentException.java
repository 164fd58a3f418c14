package com.deepansh.wordplay.exception;

/**
 * Root of the agent's unchecked exception hierarchy.
 * Anything below this type is recoverable inside the orchestrator.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
