package com.deepansh.wordplay.tool;

import com.deepansh.wordplay.exception.InvalidToolArgumentsException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered parameter schema of a tool, validated by the executor before the body runs.
 *
 * <pre>
 * ToolParameters.builder()
 *         .required("documentId", ParameterType.INTEGER, "Document to load")
 *         .optional("title", ParameterType.STRING, "New title")
 *         .build();
 * </pre>
 */
public final class ToolParameters {

    private static final ToolParameters NONE = new ToolParameters(List.of());

    private final List<ParameterSpec> specs;

    private ToolParameters(List<ParameterSpec> specs) {
        this.specs = List.copyOf(specs);
    }

    public static ToolParameters none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ParameterSpec> specs() {
        return specs;
    }

    public Optional<ParameterSpec> find(String name) {
        return specs.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    /**
     * Checks arguments against the schema and returns the violations, empty when valid.
     * Null values count as absent. Undeclared arguments are passed through untouched.
     */
    public List<String> validate(Map<String, Object> arguments) {
        List<String> violations = new ArrayList<>();
        normalise(arguments, violations);
        return violations;
    }

    /**
     * Validates and coerces in one pass.
     *
     * @throws InvalidToolArgumentsException when any argument violates the schema
     */
    public ToolArguments bind(String toolName, Map<String, Object> arguments) {
        List<String> violations = new ArrayList<>();
        Map<String, Object> coerced = normalise(arguments, violations);
        if (!violations.isEmpty()) {
            throw new InvalidToolArgumentsException(toolName, violations);
        }
        return new ToolArguments(coerced);
    }

    private Map<String, Object> normalise(Map<String, Object> arguments, List<String> violations) {
        Map<String, Object> source = arguments != null ? arguments : Map.of();
        Map<String, Object> out = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (v != null) {
                out.put(k, v);
            }
        });

        for (ParameterSpec spec : specs) {
            Object raw = out.get(spec.getName());
            if (raw == null) {
                if (spec.isRequired()) {
                    violations.add("missing required parameter '" + spec.getName() + "'");
                }
                continue;
            }

            Optional<Object> value = spec.getType().coerce(raw);
            if (value.isEmpty()) {
                violations.add("parameter '" + spec.getName() + "' must be of type "
                        + spec.getType().name().toLowerCase() + " but was " + describe(raw));
                continue;
            }

            Object coerced = value.get();
            if (!spec.getAllowedValues().isEmpty()) {
                String text = String.valueOf(coerced);
                Optional<String> canonical = spec.getAllowedValues().stream()
                        .filter(allowed -> allowed.equalsIgnoreCase(text))
                        .findFirst();
                if (canonical.isEmpty()) {
                    violations.add("parameter '" + spec.getName() + "' must be one of "
                            + spec.getAllowedValues() + " but was '" + text + "'");
                    continue;
                }
                coerced = spec.getType() == ParameterType.STRING ? canonical.get() : coerced;
            }
            out.put(spec.getName(), coerced);
        }
        return out;
    }

    private static String describe(Object raw) {
        String type = raw instanceof Map<?, ?> ? "object"
                : raw instanceof List<?> ? "array"
                : raw.getClass().getSimpleName().toLowerCase();
        return type + " '" + abbreviate(String.valueOf(raw)) + "'";
    }

    private static String abbreviate(String s) {
        return s.length() > 40 ? s.substring(0, 40) + "..." : s;
    }

    /** JSON Schema object describing these parameters, as sent to the model. */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ParameterSpec spec : specs) {
            Map<String, Object> property = new LinkedHashMap<>();
            if (spec.getType().jsonType() != null) {
                property.put("type", spec.getType().jsonType());
            }
            if (spec.getDescription() != null) {
                property.put("description", spec.getDescription());
            }
            if (!spec.getAllowedValues().isEmpty()) {
                property.put("enum", spec.getAllowedValues());
            }
            properties.put(spec.getName(), property);
            if (spec.isRequired()) {
                required.add(spec.getName());
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", Collections.unmodifiableList(required));
        return schema;
    }

    public static final class Builder {

        private final List<ParameterSpec> specs = new ArrayList<>();

        public Builder required(String name, ParameterType type, String description) {
            return add(name, type, true, description, List.of());
        }

        public Builder optional(String name, ParameterType type, String description) {
            return add(name, type, false, description, List.of());
        }

        public Builder requiredOneOf(String name, String description, String... allowed) {
            return add(name, ParameterType.STRING, true, description, List.of(allowed));
        }

        public Builder optionalOneOf(String name, String description, String... allowed) {
            return add(name, ParameterType.STRING, false, description, List.of(allowed));
        }

        private Builder add(String name, ParameterType type, boolean required,
                            String description, List<String> allowed) {
            if (specs.stream().anyMatch(s -> s.getName().equals(name))) {
                throw new IllegalArgumentException("Parameter '" + name + "' declared twice");
            }
            specs.add(ParameterSpec.builder()
                    .name(name)
                    .type(type)
                    .required(required)
                    .description(description)
                    .allowedValues(allowed)
                    .build());
            return this;
        }

        public ToolParameters build() {
            return new ToolParameters(specs);
        }
    }
}
