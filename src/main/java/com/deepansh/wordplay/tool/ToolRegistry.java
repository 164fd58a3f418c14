package com.deepansh.wordplay.tool;

import com.deepansh.wordplay.exception.DuplicateToolException;
import com.deepansh.wordplay.exception.UnknownToolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for all AgentTool implementations.
 *
 * Spring auto-discovers every @Component that implements AgentTool and injects them as a
 * List<AgentTool>. Two beans sharing a name fail startup with DuplicateToolException.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<AgentTool> toolBeans) {
        toolBeans.forEach(this::register);
        log.info("Total tools registered: {}", tools.size());
    }

    public void register(AgentTool tool) {
        if (tools.putIfAbsent(tool.getName(), tool) != null) {
            throw new DuplicateToolException(tool.getName());
        }
        log.info("Registered tool: [{}] ({})", tool.getName(), tool.getCategory());
    }

    /** @throws UnknownToolException when no tool has this name */
    public AgentTool get(String name) {
        return find(name).orElseThrow(() -> new UnknownToolException(name));
    }

    public Optional<AgentTool> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    /** Definitions sorted by category, then name, so prompts and listings are stable. */
    public List<ToolDefinition> list() {
        return tools.values().stream()
                .sorted((a, b) -> a.getCategory() != b.getCategory()
                        ? a.getCategory().compareTo(b.getCategory())
                        : a.getName().compareTo(b.getName()))
                .map(ToolDefinition::from)
                .toList();
    }

    public List<String> names() {
        return list().stream().map(ToolDefinition::getName).toList();
    }

    public boolean hasTool(String name) {
        return name != null && tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }
}
