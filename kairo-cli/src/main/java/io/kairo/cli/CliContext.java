package io.kairo.cli;

import io.kairo.core.config.ConfigService;
import io.kairo.core.cron.CronService;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    CronServiceFactory cronServiceFactory,
    GatewayRunner gatewayRunner
) {
    public CliContext(ConfigService configService, Path configPath, CronServiceFactory cronServiceFactory) {
        this(configService, configPath, cronServiceFactory, drainIntervalMs -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }

    /**
     * Opens a stopped engine over the configured store. Callers close it.
     */
    public CronService openCronService() throws IOException {
        return cronServiceFactory.create(configService.load(configPath));
    }
}
