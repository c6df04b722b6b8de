package io.kairo.core.tool;

import java.util.Map;

/**
 * Capability exposed to the agent. Implementations report problems as {@code "Error: ..."} results
 * instead of throwing.
 */
public interface Tool {
    String name();

    String description();

    default Map<String, Object> schema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    String execute(Map<String, Object> input, ToolContext context);
}
