package io.kairo.cli;

import io.kairo.core.cron.CronJob;
import io.kairo.core.cron.CronJobDefinition;
import io.kairo.core.cron.CronJobEvent;
import io.kairo.core.cron.CronPayload;
import io.kairo.core.cron.CronSchedule;
import io.kairo.core.cron.CronService;
import io.kairo.core.cron.NaturalTimeParser;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(name = "cron", description = "Manage scheduled jobs")
public final class CronCommand implements Runnable {
    private static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
        .withZone(ZoneId.systemDefault());

    @Spec
    CommandSpec spec;

    public static CommandLine create(CliContext context) {
        CommandLine cron = new CommandLine(new CronCommand());
        cron.addSubcommand("list", new ListJobs(context));
        cron.addSubcommand("add", new AddJob(context));
        cron.addSubcommand("remove", new RemoveJob(context));
        cron.addSubcommand("enable", new EnableJob(context));
        cron.addSubcommand("run", new RunJob(context));
        cron.addSubcommand("status", new Status(context));
        return cron;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    static String formatTime(Long epochMs) {
        return epochMs == null ? "-" : LOCAL_TIME.format(Instant.ofEpochMilli(epochMs));
    }

    @Command(name = "list", description = "List scheduled jobs")
    static final class ListJobs implements Callable<Integer> {
        private final CliContext context;

        @Option(names = {"-a", "--all"}, description = "Include disabled jobs")
        boolean all;

        ListJobs(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try (CronService cronService = context.openCronService()) {
                List<CronJob> jobs = cronService.listJobs(all);
                if (jobs.isEmpty()) {
                    System.out.println("No scheduled jobs.");
                    return 0;
                }
                System.out.println(String.format("%-10s %-20s %-32s %-9s %-16s %s", "ID", "Name", "Schedule", "Status", "Next Run", "Last"));
                for (CronJob job : jobs) {
                    System.out.println(String.format(
                        "%-10s %-20s %-32s %-9s %-16s %s",
                        job.id(),
                        job.name(),
                        job.schedule().describe(),
                        job.enabled() ? "enabled" : "disabled",
                        formatTime(job.state().nextRunAtMs()),
                        job.state().lastStatus() == null ? "-" : job.state().lastStatus()
                    ));
                }
                System.out.println("Total: " + jobs.size() + " job(s)");
                return 0;
            } catch (Exception e) {
                System.err.println("Cron list failed: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "add", description = "Add a scheduled job")
    static final class AddJob implements Callable<Integer> {
        private final CliContext context;

        @Option(names = {"-n", "--name"}, required = true, description = "Job name")
        String name;

        @Option(names = {"-m", "--message"}, required = true, description = "Message for the agent")
        String message;

        @Option(names = {"-e", "--every"}, description = "Run every N seconds")
        Long everySeconds;

        @Option(names = {"-c", "--cron"}, description = "Cron expression, e.g. '0 9 * * *'")
        String cronExpr;

        @Option(names = "--tz", description = "IANA timezone for --cron, e.g. 'America/Vancouver'")
        String tz;

        @Option(names = "--at", description = "Run once: ISO time, 'in 10m', 'tomorrow at 9am'")
        String at;

        @Option(names = {"-d", "--deliver"}, description = "Deliver the response to a channel")
        boolean deliver;

        @Option(names = "--channel", description = "Delivery channel, e.g. 'telegram'")
        String channel;

        @Option(names = "--to", description = "Delivery recipient")
        String to;

        @Option(names = "--delete-after-run", description = "Delete a one-shot job once it has run")
        boolean deleteAfterRun;

        AddJob(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            int scheduleOptions = (everySeconds != null ? 1 : 0) + (cronExpr != null ? 1 : 0) + (at != null ? 1 : 0);
            if (scheduleOptions != 1) {
                System.err.println("Cron add failed: specify exactly one of --every, --cron or --at");
                return 1;
            }
            if (tz != null && cronExpr == null) {
                System.err.println("Cron add failed: --tz can only be used with --cron");
                return 1;
            }

            try (CronService cronService = context.openCronService()) {
                CronJob job = cronService.addJob(new CronJobDefinition(
                    name,
                    schedule(),
                    new CronPayload(message, deliver, channel, to),
                    deleteAfterRun
                ));
                System.out.println("Added job '" + job.name() + "' (" + job.id() + ")");
                if (job.state().nextRunAtMs() == null) {
                    System.out.println("Warning: job has no upcoming run");
                }
                return 0;
            } catch (Exception e) {
                System.err.println("Cron add failed: " + e.getMessage());
                return 1;
            }
        }

        private CronSchedule schedule() {
            if (everySeconds != null) {
                try {
                    return CronSchedule.every(Math.multiplyExact(everySeconds, 1000L));
                } catch (ArithmeticException e) {
                    throw new IllegalArgumentException("--every is too large: " + everySeconds, e);
                }
            }
            if (cronExpr != null) {
                return CronSchedule.cron(cronExpr, tz);
            }
            return CronSchedule.at(new NaturalTimeParser(Clock.systemUTC(), ZoneId.systemDefault()).parseToEpochMs(at));
        }
    }

    @Command(name = "remove", description = "Remove a scheduled job")
    static final class RemoveJob implements Callable<Integer> {
        private final CliContext context;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        RemoveJob(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try (CronService cronService = context.openCronService()) {
                if (cronService.removeJob(jobId)) {
                    System.out.println("Removed job " + jobId);
                    return 0;
                }
                System.out.println("Job " + jobId + " not found");
                return 1;
            } catch (Exception e) {
                System.err.println("Cron remove failed: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "enable", description = "Enable (or with --disable, disable) a job")
    static final class EnableJob implements Callable<Integer> {
        private final CliContext context;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Option(names = "--disable", description = "Disable instead of enable")
        boolean disable;

        EnableJob(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try (CronService cronService = context.openCronService()) {
                Optional<CronJob> job = cronService.enableJob(jobId, !disable);
                if (job.isEmpty()) {
                    System.out.println("Job " + jobId + " not found");
                    return 1;
                }
                System.out.println("Job '" + job.get().name() + "' " + (disable ? "disabled" : "enabled"));
                return 0;
            } catch (Exception e) {
                System.err.println("Cron enable failed: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "run", description = "Run a job now, even if it is disabled")
    static final class RunJob implements Callable<Integer> {
        private final CliContext context;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        RunJob(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try (CronService cronService = context.openCronService()) {
                Optional<CronJobEvent> event = cronService.runJob(jobId);
                if (event.isEmpty()) {
                    System.out.println("Job " + jobId + " not found");
                    return 1;
                }
                if (!event.get().success()) {
                    System.out.println("Job " + jobId + " failed: " + event.get().error());
                    return 1;
                }
                System.out.println("Job executed");
                if (event.get().response() != null) {
                    System.out.println(event.get().response());
                }
                return 0;
            } catch (Exception e) {
                System.err.println("Cron run failed: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "Show scheduler status")
    static final class Status implements Callable<Integer> {
        private final CliContext context;

        Status(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try (CronService cronService = context.openCronService()) {
                var status = cronService.getStatus();
                System.out.println("Running: " + status.running());
                System.out.println("Jobs: " + status.totalJobs() + " (" + status.enabledJobs() + " enabled)");
                System.out.println("Next wake: " + formatTime(status.nextWakeAtMs()));
                return 0;
            } catch (Exception e) {
                System.err.println("Cron status failed: " + e.getMessage());
                return 1;
            }
        }
    }
}
