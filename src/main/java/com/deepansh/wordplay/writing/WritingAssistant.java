package com.deepansh.wordplay.writing;

import com.deepansh.wordplay.exception.ModelCallException;
import com.deepansh.wordplay.llm.CompletionOptions;
import com.deepansh.wordplay.llm.LlmClient;
import com.deepansh.wordplay.llm.ModelReplyParser;
import com.deepansh.wordplay.text.TextOperations;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Model-backed writing operations behind the generation tools.
 *
 * Failure policy differs per operation: generation and text commands propagate
 * {@link ModelCallException} so the calling tool fails; style analysis degrades to neutral
 * heuristic metrics; suggestions degrade to an empty list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WritingAssistant {

    private static final int MIN_ANALYZABLE_LENGTH = 20;

    private final LlmClient llmClient;
    private final ModelReplyParser replyParser;

    public String generateText(String content, Map<String, Object> style, String prompt, String model) {
        String system = """
                You are an AI writing assistant that helps users create high-quality content.
                You should adapt to their writing style and preferences.
                Style analysis: %s
                Your task is to generate text that continues or expands the provided content \
                while maintaining the same style, tone, and complexity.""".formatted(replyParser.toJson(style));

        String instruction = prompt != null && !prompt.isBlank() ? prompt : "Continue this text in the same style.";
        String user = (content != null ? content : "") + "\n\n" + instruction;

        return llmClient.complete(system, user, CompletionOptions.builder()
                .purpose("generate_text")
                .model(model)
                .maxTokens(500)
                .build());
    }

    public StyleAnalysis analyzeStyle(String text, String model) {
        int words = TextOperations.countWords(text);
        if (text == null || text.length() < MIN_ANALYZABLE_LENGTH) {
            return StyleAnalysis.builder()
                    .formality(50).complexity(50).coherence(50).engagement(50).conciseness(50)
                    .readabilityScore(50).readabilityGrade("Not determined")
                    .commonPhrases(List.of("Not enough text for analysis"))
                    .suggestions(List.of("Add more content to get detailed analysis"))
                    .toneAnalysis("Not enough text to determine tone")
                    .build();
        }

        String system = """
                You are a text analysis expert. Analyze the given text and evaluate its style metrics.
                Return a JSON object with:
                - metrics: {formality, complexity, coherence, engagement, conciseness}, each 0-100
                - readability: {score: 0-100, grade: string such as "College Level"}
                - wordDistribution: {unique, repeated, rare} word counts
                - commonPhrases: array of strings
                - suggestions: array of improvement suggestions
                - toneAnalysis: string""";

        try {
            String raw = llmClient.complete(system, text, CompletionOptions.builder()
                    .purpose("analyze_writing_style")
                    .model(model)
                    .jsonResponse(true)
                    .build());
            JsonNode node = replyParser.parseObject(raw, JsonNode.class)
                    .orElseThrow(() -> new ModelCallException("Style analysis reply was not a JSON object"));
            return fromReply(node, words);
        } catch (ModelCallException e) {
            log.warn("Style analysis fell back to defaults: {}", e.getMessage());
            return StyleAnalysis.builder()
                    .formality(50).complexity(50).coherence(50).engagement(50).conciseness(50)
                    .readabilityScore(50).readabilityGrade("Analysis unavailable")
                    .commonPhrases(List.of("Analysis unavailable"))
                    .suggestions(List.of("Try again with more text", "Check your connection",
                            "Ensure text is meaningful"))
                    .toneAnalysis("Analysis unavailable")
                    .uniqueWords((int) Math.ceil(words * 0.7))
                    .repeatedWords((int) Math.floor(words * 0.2))
                    .rareWords((int) Math.floor(words * 0.1))
                    .fallback(true)
                    .build();
        }
    }

    private StyleAnalysis fromReply(JsonNode node, int words) {
        JsonNode metrics = node.path("metrics");
        JsonNode readability = node.path("readability");
        JsonNode distribution = node.path("wordDistribution");

        return StyleAnalysis.builder()
                .formality(normalize(metrics.path("formality")))
                .complexity(normalize(metrics.path("complexity")))
                .coherence(normalize(metrics.path("coherence")))
                .engagement(normalize(metrics.path("engagement")))
                .conciseness(normalize(metrics.path("conciseness")))
                .readabilityScore(normalize(readability.path("score")))
                .readabilityGrade(readability.path("grade").asText("General Audience"))
                .commonPhrases(strings(node.path("commonPhrases"),
                        List.of("Clear writing", "Effective communication")))
                .suggestions(strings(node.path("suggestions"),
                        List.of("Continue developing your ideas", "Add supporting evidence", "Consider your audience")))
                .toneAnalysis(node.path("toneAnalysis").asText("The text has a neutral, informative tone"))
                .uniqueWords(positiveOr(distribution.path("unique"), (int) Math.ceil(words * 0.7)))
                .repeatedWords(positiveOr(distribution.path("repeated"), (int) Math.floor(words * 0.2)))
                .rareWords(positiveOr(distribution.path("rare"), (int) Math.floor(words * 0.1)))
                .build();
    }

    /** Scores at or below 1 are read as a 0-1 scale; everything is clamped to 0-100. */
    static int normalize(JsonNode value) {
        double num;
        if (value.isNumber()) {
            num = value.asDouble();
        } else if (value.isTextual()) {
            try {
                num = Double.parseDouble(value.asText().strip());
            } catch (NumberFormatException e) {
                return 50;
            }
        } else {
            return 50;
        }
        if (Double.isNaN(num)) {
            return 50;
        }
        if (num <= 1) {
            num *= 100;
        }
        return (int) Math.min(100, Math.max(0, Math.round(num)));
    }

    private static int positiveOr(JsonNode value, int fallback) {
        int parsed = value.asInt(0);
        return parsed > 0 ? parsed : fallback;
    }

    private static List<String> strings(JsonNode array, List<String> fallback) {
        if (!array.isArray()) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        array.forEach(n -> out.add(n.asText()));
        return out;
    }

    public List<String> suggestions(String content, Map<String, Object> style, String type, String model) {
        String system = """
                You are an AI writing assistant that provides helpful suggestions to improve the user's writing.
                Suggestion type: %s.
                Based on their current document, generate 3 suggestions that match their writing style.
                Style analysis: %s
                Respond with a JSON object: {"suggestions": ["...", "...", "..."]}"""
                .formatted(type != null ? type : "improvement", replyParser.toJson(style));
        try {
            String raw = llmClient.complete(system, content != null ? content : "", CompletionOptions.builder()
                    .purpose("get_writing_suggestions")
                    .model(model)
                    .jsonResponse(true)
                    .build());
            return replyParser.parseObject(raw, SuggestionsReply.class)
                    .map(SuggestionsReply::suggestions)
                    .map(List::copyOf)
                    .orElse(List.of());
        } catch (ModelCallException e) {
            log.warn("Writing suggestions unavailable: {}", e.getMessage());
            return List.of();
        }
    }

    public TextCommandResult processCommand(String content, String command, String model) {
        String system = """
                You are an AI assistant that processes text manipulation commands similar to grep and sed.
                You will receive a document and a command. Parse the command and perform the requested operation.
                Common commands include:
                - grep 'pattern': find and return all instances of a pattern
                - replace 'old' 'new': replace all instances of 'old' with 'new'
                - style analyze: analyze the writing style
                - format paragraph: improve formatting and readability
                Return a JSON object with two fields:
                - result: the resulting text after applying the command
                - message: a description of the changes made""";
        String source = content != null ? content : "";

        String raw = llmClient.complete(system, "Document:\n" + source + "\n\nCommand: " + command,
                CompletionOptions.builder()
                        .purpose("process_text_command")
                        .model(model)
                        .jsonResponse(true)
                        .build());

        TextCommandResult reply = replyParser.parseObject(raw, TextCommandResult.class)
                .orElseThrow(() -> new ModelCallException("Text command reply was not a JSON object"));
        return new TextCommandResult(
                reply.result() != null ? reply.result() : source,
                reply.message() != null ? reply.message() : "Command processed successfully.");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SuggestionsReply(List<String> suggestions) {
        SuggestionsReply {
            suggestions = suggestions != null ? suggestions : List.of();
        }
    }
}
