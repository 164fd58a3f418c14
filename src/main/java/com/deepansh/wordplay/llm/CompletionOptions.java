package com.deepansh.wordplay.llm;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call overrides. Null fields fall back to the active provider's configuration.
 */
@Value
@Builder(toBuilder = true)
public class CompletionOptions {

    /** Short label for logs, e.g. "planner", "synthesizer". */
    @Builder.Default
    String purpose = "completion";

    String model;
    Integer maxTokens;
    Double temperature;

    /** Ask the provider for a JSON object reply where it supports response_format. */
    boolean jsonResponse;

    public static CompletionOptions defaults() {
        return CompletionOptions.builder().build();
    }

    public static CompletionOptions json(String purpose) {
        return CompletionOptions.builder().purpose(purpose).jsonResponse(true).build();
    }
}
