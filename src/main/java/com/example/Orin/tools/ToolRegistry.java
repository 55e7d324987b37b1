package com.example.Orin.tools;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Central registry for all agent tools.
 * It knows which tools exist and resolves a requested tool name to its implementation.
 */
@Component
public class ToolRegistry {

    private final Map<String, AgentTool> toolsByName;

    public ToolRegistry(List<AgentTool> tools) {
        Map<String, AgentTool> byName = new LinkedHashMap<>();
        for (AgentTool tool : tools) {
            AgentTool previous = byName.putIfAbsent(tool.name(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.name());
            }
        }
        this.toolsByName = Collections.unmodifiableMap(byName);
    }

    /**
     * Look up a tool by its name.
     */
    public Optional<AgentTool> findByName(String name) {
        return Optional.ofNullable(name).map(toolsByName::get);
    }

    /**
     * The tool catalog offered to the model, in registration order.
     */
    public List<AgentTool> allTools() {
        return List.copyOf(toolsByName.values());
    }
}
