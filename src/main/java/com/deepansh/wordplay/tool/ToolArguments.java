package com.deepansh.wordplay.tool;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Arguments of one call after schema validation. Declared parameters already hold their
 * canonical types: INTEGER as Long, NUMBER as Double, BOOLEAN as Boolean.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    /** Present and, for strings, not blank. */
    public boolean hasText(String name) {
        Object value = values.get(name);
        return value != null && !(value instanceof String s && s.isBlank());
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value != null ? value.toString() : null;
    }

    public String getString(String name, String defaultValue) {
        return has(name) ? getString(name) : defaultValue;
    }

    public Long getLong(String name) {
        Object value = values.get(name);
        return value instanceof Number n ? n.longValue() : null;
    }

    public int getInt(String name, int defaultValue) {
        Long value = getLong(name);
        return value != null ? Math.toIntExact(value) : defaultValue;
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = values.get(name);
        return value instanceof Boolean b ? b : defaultValue;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String name) {
        Object value = values.get(name);
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    public List<String> getStringList(String name) {
        Object value = values.get(name);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().map(String::valueOf).toList();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
