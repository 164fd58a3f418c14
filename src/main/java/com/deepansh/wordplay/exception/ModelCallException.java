package com.deepansh.wordplay.exception;

/**
 * Upstream model/provider failure. Not retried and not counted by the circuit breaker;
 * see {@link ModelUnavailableException} for the transient variant.
 */
public class ModelCallException extends AgentException {

    public ModelCallException(String message) {
        super(message);
    }

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
