package io.kairo.cli;

import io.kairo.core.config.ConfigPaths;
import io.kairo.core.config.model.KairoConfig;
import io.kairo.core.cron.CronService;
import io.kairo.core.cron.CronServiceStatus;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show runtime and configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            KairoConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + ConfigPaths.resolveWorkspace(config.workspace()));
            System.out.println("Cron enabled: " + config.cron().enabled());
            System.out.println("Cron store: " + ConfigPaths.resolveCronStore(config.cron().storePath()));
            try (CronService cronService = context.cronServiceFactory().create(config)) {
                CronServiceStatus status = cronService.getStatus();
                System.out.println("Cron jobs: " + status.totalJobs() + " (" + status.enabledJobs() + " enabled)");
                System.out.println("Next wake: " + CronCommand.formatTime(status.nextWakeAtMs()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
