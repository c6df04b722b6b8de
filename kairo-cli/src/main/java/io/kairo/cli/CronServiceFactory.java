package io.kairo.cli;

import io.kairo.core.config.model.KairoConfig;
import io.kairo.core.cron.CronService;

@FunctionalInterface
public interface CronServiceFactory {
    CronService create(KairoConfig config);
}
