package io.kairo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronConfig(
    boolean enabled,
    String storePath
) {

    public static CronConfig defaults() {
        return new CronConfig(true, "~/.kairo/cron/jobs.json");
    }
}
