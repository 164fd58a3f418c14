package com.deepansh.wordplay.tool;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Primitive parameter kinds a tool may declare.
 *
 * {@link #coerce} normalises a raw JSON-decoded value to the canonical Java type
 * (String, Long, Double, Boolean, Map, List) or returns empty when the value does not fit.
 * Numeric strings are accepted for INTEGER and NUMBER since models routinely quote them.
 */
public enum ParameterType {

    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array"),
    ANY(null);

    private static final Pattern INTEGRAL = Pattern.compile("-?\\d+");

    private final String jsonType;

    ParameterType(String jsonType) {
        this.jsonType = jsonType;
    }

    /** JSON Schema "type" keyword, or null for ANY. */
    public String jsonType() {
        return jsonType;
    }

    public Optional<Object> coerce(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (this) {
            case STRING -> raw instanceof CharSequence || raw instanceof Number || raw instanceof Boolean
                    ? Optional.of(raw.toString())
                    : Optional.empty();
            case INTEGER -> toLong(raw);
            case NUMBER -> toDouble(raw);
            case BOOLEAN -> toBoolean(raw);
            case OBJECT -> raw instanceof Map<?, ?> ? Optional.of(raw) : Optional.empty();
            case ARRAY -> raw instanceof List<?> ? Optional.of(raw) : Optional.empty();
            case ANY -> Optional.of(raw);
        };
    }

    private static Optional<Object> toLong(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return Optional.of(((Number) raw).longValue());
        }
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return d == Math.rint(d) && !Double.isInfinite(d) ? Optional.of((long) d) : Optional.empty();
        }
        if (raw instanceof String s && INTEGRAL.matcher(s.strip()).matches()) {
            try {
                return Optional.of(Long.parseLong(s.strip()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<Object> toDouble(Object raw) {
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(new BigDecimal(s.strip()).doubleValue());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<Object> toBoolean(Object raw) {
        if (raw instanceof Boolean) {
            return Optional.of(raw);
        }
        if (raw instanceof String s) {
            if (s.strip().equalsIgnoreCase("true")) {
                return Optional.of(Boolean.TRUE);
            }
            if (s.strip().equalsIgnoreCase("false")) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }
}
