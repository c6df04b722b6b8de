package io.kairo.core.tool;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tools available to the agent, keyed by {@link Tool#name()}. The registry is the seam a host agent
 * loop plugs into; the CLI and gateway in this repository drive {@code CronService} directly.
 */
public final class ToolRegistry {
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public void register(Tool tool) {
        tools.put(tool.name(), tool);
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<String> names() {
        return tools.keySet().stream().sorted().toList();
    }

    public String execute(String name, Map<String, Object> input, ToolContext context) {
        return find(name)
            .map(tool -> tool.execute(input, context))
            .orElse("Error: unknown tool: " + name);
    }
}
