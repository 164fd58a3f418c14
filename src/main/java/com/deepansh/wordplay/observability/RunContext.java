package com.deepansh.wordplay.observability;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable per-request counters for the execution details of a response.
 * Created at the start of each agent request and read when the response is assembled.
 *
 * Kept separate from ExecutionContext (which holds session state) so run accounting
 * doesn't bleed into what the tools see.
 */
@Getter
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<String> modelFallbacks = new ArrayList<>();
    private int reflections;

    /** Records that a model-backed stage served a deterministic fallback. */
    public void recordModelFallback(String stage) {
        modelFallbacks.add(stage);
    }

    public void recordReflection() {
        reflections++;
    }

    public List<String> getModelFallbacks() {
        return Collections.unmodifiableList(modelFallbacks);
    }

    public int modelFallbackCount() {
        return modelFallbacks.size();
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public boolean exceeded(long budgetMs) {
        return elapsedMs() >= budgetMs;
    }
}
