package com.deepansh.wordplay.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class SynthesisResult {

    String narrative;
    @Builder.Default
    List<String> suggestedActions = List.of();
    @Builder.Default
    List<ToolCall> additionalToolCalls = List.of();
    ContinuousOperationPlan continuousOperationPlan;
    @Builder.Default
    List<ResearchFinding> researchFindings = List.of();
    /** True when the model tier failed and the template generator produced this result. */
    boolean fallback;

    public boolean hasAdditionalToolCalls() {
        return additionalToolCalls != null && !additionalToolCalls.isEmpty();
    }
}
