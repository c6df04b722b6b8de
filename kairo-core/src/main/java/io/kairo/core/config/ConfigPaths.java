package io.kairo.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path homeDirectory() {
        return Path.of(System.getProperty("user.home"), ".kairo");
    }

    public static Path defaultConfigPath() {
        return homeDirectory().resolve("config.json");
    }

    public static Path defaultCronStorePath() {
        return homeDirectory().resolve("cron").resolve("jobs.json");
    }

    public static Path resolveWorkspace(String rawPath) {
        return resolve(rawPath, homeDirectory().resolve("workspace"));
    }

    public static Path resolveCronStore(String rawPath) {
        return resolve(rawPath, defaultCronStorePath());
    }

    static Path resolve(String rawPath, Path fallback) {
        if (rawPath == null || rawPath.isBlank()) {
            return fallback;
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
