package io.kairo.app;

import io.kairo.cli.CliContext;
import io.kairo.cli.CronCommand;
import io.kairo.cli.GatewayCommand;
import io.kairo.cli.KairoCliCommand;
import io.kairo.cli.OnboardCommand;
import io.kairo.cli.StatusCommand;
import io.kairo.core.bus.InMemoryMessageBus;
import io.kairo.core.bus.MessageBus;
import io.kairo.core.bus.OutboundMessage;
import io.kairo.core.config.ConfigPaths;
import io.kairo.core.config.ConfigService;
import io.kairo.core.config.model.KairoConfig;
import io.kairo.core.cron.CronDeliveryListener;
import io.kairo.core.cron.CronJobHandler;
import io.kairo.core.cron.CronService;
import io.kairo.core.cron.FileCronStore;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class KairoApplication {
    private static final Logger LOG = LoggerFactory.getLogger(KairoApplication.class);

    private KairoApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        CronJobHandler jobHandler = new EchoJobHandler();

        CliContext context = new CliContext(
            configService,
            configPath,
            config -> buildCronService(config, jobHandler),
            drainIntervalMs -> runGateway(configService, configPath, jobHandler, drainIntervalMs)
        );

        CommandLine commandLine = new CommandLine(new KairoCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("cron", CronCommand.create(context));
        commandLine.addSubcommand("gateway", new GatewayCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static CronService buildCronService(KairoConfig config, CronJobHandler jobHandler) {
        Path storePath = ConfigPaths.resolveCronStore(config.cron().storePath());
        return new CronService(new FileCronStore(storePath), Clock.systemUTC(), jobHandler);
    }

    private static int runGateway(
        ConfigService configService,
        Path configPath,
        CronJobHandler jobHandler,
        long drainIntervalMs
    ) throws Exception {
        KairoConfig config = configService.load(configPath);
        MessageBus messageBus = new InMemoryMessageBus();
        CountDownLatch shutdown = new CountDownLatch(1);
        ScheduledExecutorService drainer = Executors.newSingleThreadScheduledExecutor();

        try (CronService cronService = buildCronService(config, jobHandler)) {
            cronService.addListener(new CronDeliveryListener(messageBus));
            cronService.addListener(event -> {
                if (!event.success()) {
                    LOG.warn("Cron job {} failed: {}", event.job().id(), event.error());
                }
            });
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));

            if (config.cron().enabled()) {
                cronService.start();
            } else {
                LOG.info("Cron is disabled in {}, scheduler not started", configPath);
            }
            drainer.scheduleWithFixedDelay(
                () -> drain(messageBus),
                drainIntervalMs,
                Math.max(1L, drainIntervalMs),
                TimeUnit.MILLISECONDS
            );
            System.out.println("Gateway started; cron " + (config.cron().enabled() ? "running" : "disabled"));
            shutdown.await();
        } finally {
            drainer.shutdownNow();
            drain(messageBus);
        }
        return 0;
    }

    private static void drain(MessageBus messageBus) {
        for (OutboundMessage outbound : messageBus.drain()) {
            String target = outbound.to() == null ? outbound.channel() : outbound.channel() + ":" + outbound.to();
            System.out.println("[" + target + "] " + outbound.content());
        }
    }
}
