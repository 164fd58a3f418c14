package com.deepansh.wordplay.tool.impl;

import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.MemoryEntry;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ParameterType;
import com.deepansh.wordplay.tool.ToolArguments;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolParameters;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Reads a memory entry. Each successful recall counts as one access. */
@Component
public class RecallMemoryTool implements AgentTool {

    private static final ToolParameters PARAMETERS = ToolParameters.builder()
            .required("key", ParameterType.STRING, "Key used with store_memory")
            .build();

    @Override
    public String getName() {
        return "recall_memory";
    }

    @Override
    public String getDescription() {
        return "Recall information previously stored with store_memory.";
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
        Optional<MemoryEntry> entry = context.recallMemory(key);
        if (entry.isEmpty()) {
            return ToolResult.failure("No memory stored under key '" + key + "'");
        }

        MemoryEntry e = entry.get();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("key", e.getKey());
        data.put("value", e.getValue());
        data.put("category", e.getCategory());
        data.put("timestamp", e.getTimestamp());
        data.put("accessCount", e.getAccessCount());
        return ToolResult.ok(data, "Recalled memory: " + key);
    }
}
