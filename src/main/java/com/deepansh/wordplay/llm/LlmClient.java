package com.deepansh.wordplay.llm;

import com.deepansh.wordplay.exception.ModelCallException;

/**
 * Single-shot completion against a chat model.
 *
 * Every failure (provider error, timeout, open circuit, empty reply) surfaces as a
 * {@link ModelCallException}; callers are expected to own a deterministic fallback.
 */
public interface LlmClient {

    String complete(String systemPrompt, String userPrompt, CompletionOptions options);

    default String complete(String systemPrompt, String userPrompt) {
        return complete(systemPrompt, userPrompt, CompletionOptions.defaults());
    }
}
