package com.deepansh.wordplay.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a model's free-text reply into a typed object.
 *
 * Three guards before parsing: blank reply, markdown fences, and prose around the JSON
 * object (only the outermost {...} span is parsed).
 */
@Component
@Slf4j
public class ModelReplyParser {

    private final ObjectMapper objectMapper;

    public ModelReplyParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> Optional<T> parseObject(String raw, Class<T> type) {
        if (raw == null || raw.isBlank()) {
            log.debug("Empty model reply for {}", type.getSimpleName());
            return Optional.empty();
        }

        String cleaned = raw.strip()
                .replaceAll("(?s)^```json\\s*", "")
                .replaceAll("(?s)^```\\s*", "")
                .replaceAll("(?s)```\\s*$", "")
                .strip();

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.warn("Model reply is not a JSON object, first 100 chars: '{}'",
                    cleaned.substring(0, Math.min(100, cleaned.length())));
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(objectMapper.readValue(cleaned.substring(start, end + 1), type));
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse model reply as {}: {}", type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
