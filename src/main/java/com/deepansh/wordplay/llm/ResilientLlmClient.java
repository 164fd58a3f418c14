package com.deepansh.wordplay.llm;

import com.deepansh.wordplay.exception.ModelCallException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Decorator around the active client that adds retry + circuit breaker.
 *
 * Retry config (application.yml): 3 attempts with exponential backoff, only for
 * ModelUnavailableException and network errors.
 *
 * Circuit breaker: opens after 50% failures in a sliding window of 10 calls and waits
 * 30s before probing.
 *
 * Both fallbacks rethrow as ModelCallException: the planner, reflector and synthesizer
 * switch to their template paths on that type.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitBreakerFallback")
    public String complete(String systemPrompt, String userPrompt, CompletionOptions options) {
        return delegate.complete(systemPrompt, userPrompt, options);
    }

    public String retryFallback(String systemPrompt, String userPrompt,
                                CompletionOptions options, Exception ex) {
        log.error("LLM {} call failed after all retries: {}", options.getPurpose(), ex.getMessage());
        throw asModelCallException(ex);
    }

    public String circuitBreakerFallback(String systemPrompt, String userPrompt,
                                         CompletionOptions options, Exception ex) {
        log.error("LLM circuit breaker rejected {} call: {}", options.getPurpose(), ex.getMessage());
        throw asModelCallException(ex);
    }

    private ModelCallException asModelCallException(Exception ex) {
        if (ex instanceof ModelCallException mce) {
            return mce;
        }
        return new ModelCallException("Model call failed: " + ex.getMessage(), ex);
    }
}
