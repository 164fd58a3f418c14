package com.deepansh.wordplay.text;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Grep/sed-style text utilities shared by the text-processing and editor tools.
 * Paragraphs are separated by one or more blank lines.
 */
public final class TextOperations {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    /** Average adult reading speed, words per minute. */
    private static final int WORDS_PER_MINUTE = 225;

    private TextOperations() {
    }

    public static int countWords(String content) {
        if (content == null || content.isBlank()) {
            return 0;
        }
        return (int) Arrays.stream(WHITESPACE.split(content.strip()))
                .filter(w -> !w.isEmpty())
                .count();
    }

    public static GrepResult grep(String content, String pattern, boolean caseSensitive) {
        Matcher matcher = compile(pattern, caseSensitive).matcher(content != null ? content : "");
        List<String> matches = new ArrayList<>();
        while (matcher.find()) {
            matches.add(matcher.group());
        }
        return new GrepResult(matches, matches.size());
    }

    public static ReplaceResult replace(String content, String pattern, String replacement,
                                        boolean global, boolean caseSensitive) {
        String source = content != null ? content : "";
        Matcher matcher = compile(pattern, caseSensitive).matcher(source);
        String literal = Matcher.quoteReplacement(replacement != null ? replacement : "");

        StringBuilder sb = new StringBuilder();
        int count = 0;
        while (matcher.find()) {
            matcher.appendReplacement(sb, literal);
            count++;
            if (!global) {
                break;
            }
        }
        matcher.appendTail(sb);
        return new ReplaceResult(sb.toString(), count);
    }

    public static List<String> splitParagraphs(String content) {
        if (content == null || content.isBlank()) {
            return new ArrayList<>();
        }
        List<String> paragraphs = new ArrayList<>();
        for (String part : PARAGRAPH_BREAK.split(content)) {
            if (!part.isBlank()) {
                paragraphs.add(part.strip());
            }
        }
        return paragraphs;
    }

    public static String joinParagraphs(List<String> paragraphs) {
        return String.join("\n\n", paragraphs);
    }

    public static DocumentStructure extractStructure(String content) {
        List<String> paragraphs = splitParagraphs(content);
        String title = paragraphs.isEmpty() ? "Untitled Document" : paragraphs.get(0);

        List<Paragraph> structured = new ArrayList<>();
        for (int i = 0; i < paragraphs.size(); i++) {
            structured.add(new Paragraph(i, paragraphs.get(i)));
        }
        return new DocumentStructure(title, structured);
    }

    public static DocumentStats analyze(String content) {
        String text = content != null ? content : "";
        int words = countWords(text);
        int sentences = (int) Arrays.stream(SENTENCE_END.split(text))
                .filter(s -> !s.isBlank())
                .count();
        return new DocumentStats(
                words,
                text.length(),
                splitParagraphs(text).size(),
                sentences,
                (int) Math.ceil(words / (double) WORDS_PER_MINUTE));
    }

    private static Pattern compile(String pattern, boolean caseSensitive) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("pattern must not be empty");
        }
        try {
            return caseSensitive
                    ? Pattern.compile(pattern)
                    : Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern '" + pattern + "': " + e.getDescription(), e);
        }
    }

    public record GrepResult(List<String> matches, int count) {}

    public record ReplaceResult(String result, int count) {}

    public record Paragraph(int id, String text) {}

    public record DocumentStructure(String title, List<Paragraph> paragraphs) {}

    public record DocumentStats(int wordCount,
                                int characterCount,
                                int paragraphCount,
                                int sentenceCount,
                                int estimatedReadingTimeMinutes) {}
}
