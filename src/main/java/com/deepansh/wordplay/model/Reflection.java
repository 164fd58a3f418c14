package com.deepansh.wordplay.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Advisory self-assessment of recent execution history. */
@Value
@Builder
public class Reflection {

    String analysis;
    @Builder.Default
    List<String> improvements = List.of();
    @Builder.Default
    List<String> toolRecommendations = List.of();
    @Builder.Default
    List<String> strategyAdjustments = List.of();
    double successRate;
    boolean fallback;
    Instant timestamp;
}
