package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.MemoryEntry;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Persists a value in the session's key-value memory. Re-storing a key overwrites it.
 */
@Component
@Slf4j
public class StoreMemoryTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("key", ParameterType.STRING, "Lookup key, e.g. 'preferred_tone'")
            .required("value", ParameterType.ANY, "Value to remember: text, number or object")
            .optional("category", ParameterType.STRING, "Grouping label. Default: general")
            .build();

    @Override
    public String getName() {
        return "store_memory";
    }

    @Override
    public String getDescription() {
        return """
                Store information in session memory for later recall with recall_memory.
                Use for research notes, user preferences, or intermediate results.
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.MEMORY;
    }

    @Override
    public ToolParameters getParameters() {
        return PARAMETERS;
    }

    @Override
    public ToolResult execute(ToolArguments arguments, ExecutionContext context) {
        String key = arguments.getString("key");
        if (key.isBlank()) {
            return ToolResult.failure("'key' must not be blank");
        }
        MemoryEntry entry = context.storeMemory(key, arguments.get("value"), arguments.getString("category"));
        log.debug("Stored memory [key={}, category={}] in session [{}]", key, entry.getCategory(), context.getSessionId());
        return ToolResult.ok(entry, "Stored memory: " + key);
    }
}
