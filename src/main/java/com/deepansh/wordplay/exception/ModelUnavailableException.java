package com.deepansh.wordplay.exception;

/**
 * Transient model failure (5xx, rate limit, network). Retried, and recorded by the
 * "llmClient" circuit breaker.
 */
public class ModelUnavailableException extends ModelCallException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
