package io.kairo.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "gateway", description = "Run the scheduler and deliver job responses until interrupted")
public final class GatewayCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--drain-interval-ms"}, description = "How often outbound messages are flushed", defaultValue = "1000")
    long drainIntervalMs;

    public GatewayCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.gatewayRunner().run(drainIntervalMs);
        } catch (Exception e) {
            System.err.println("Gateway command failed: " + e.getMessage());
            return 1;
        }
    }
}
