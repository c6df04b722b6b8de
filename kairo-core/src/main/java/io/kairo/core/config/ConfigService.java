package io.kairo.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kairo.core.config.model.KairoConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@code config.json}, filling every field the file leaves out from {@link KairoConfig#defaults()}.
 */
public final class ConfigService {
    private final ObjectMapper mapper = new ObjectMapper();

    public KairoConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return KairoConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(KairoConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, KairoConfig.class);
    }

    public void save(Path configPath, KairoConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    /**
     * Writes defaults when the file is missing (or {@code overwrite} is set), otherwise rewrites the
     * existing file with any newly introduced defaults merged in.
     */
    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        KairoConfig config = created || overwrite ? KairoConfig.defaults() : load(configPath);
        save(configPath, config);

        Path storePath = ConfigPaths.resolveCronStore(config.cron().storePath());
        Path storeDir = storePath.toAbsolutePath().getParent();
        if (storeDir != null) {
            Files.createDirectories(storeDir);
        }
        return new OnboardResult(configPath, storePath, created, !created && overwrite);
    }

    public String toPrettyJson(KairoConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null || base.isNull()) {
            return override;
        }
        if (override == null || override.isNull() || override.isMissingNode()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
