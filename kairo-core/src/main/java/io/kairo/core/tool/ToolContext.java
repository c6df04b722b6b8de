package io.kairo.core.tool;

import java.util.Map;

/**
 * Conversation the tool is invoked from, plus the runtime services it may use.
 */
public record ToolContext(String channel, String chatId, Map<String, Object> services) {

    public ToolContext(Map<String, Object> services) {
        this(null, null, services);
    }

    public <T> T service(String key, Class<T> type) {
        Object service = services.get(key);
        if (service == null) {
            return null;
        }
        if (!type.isInstance(service)) {
            throw new IllegalArgumentException("Service '" + key + "' is not of type " + type.getSimpleName());
        }
        return type.cast(service);
    }
}
