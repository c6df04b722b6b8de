package io.kairo.core.config;

import java.nio.file.Path;

public record OnboardResult(Path configPath, Path cronStorePath, boolean createdConfig, boolean overwrittenConfig) {
}
