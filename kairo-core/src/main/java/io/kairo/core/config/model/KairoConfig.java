package io.kairo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KairoConfig(
    String workspace,
    CronConfig cron
) {

    public static KairoConfig defaults() {
        return new KairoConfig("~/.kairo/workspace", CronConfig.defaults());
    }
}
