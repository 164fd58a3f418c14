package com.deepansh.wordplay.writing;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Style metrics for a piece of text. All scores are on a 0-100 scale.
 */
@Value
@Builder
public class StyleAnalysis {

    int formality;
    int complexity;
    int coherence;
    int engagement;
    int conciseness;
    int readabilityScore;
    String readabilityGrade;
    List<String> commonPhrases;
    List<String> suggestions;
    String toneAnalysis;
    int uniqueWords;
    int repeatedWords;
    int rareWords;

    /** True when the model was unavailable and these are heuristic defaults. */
    boolean fallback;

    /** Shape persisted on Document.styleMetrics. */
    public Map<String, Object> toMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("formality", formality);
        metrics.put("complexity", complexity);
        metrics.put("coherence", coherence);
        metrics.put("engagement", engagement);
        metrics.put("conciseness", conciseness);
        metrics.put("readability", Map.of("score", readabilityScore, "grade", readabilityGrade));
        metrics.put("wordDistribution", Map.of(
                "unique", uniqueWords, "repeated", repeatedWords, "rare", rareWords));
        metrics.put("commonPhrases", commonPhrases);
        metrics.put("suggestions", suggestions);
        metrics.put("toneAnalysis", toneAnalysis);
        return metrics;
    }
}
