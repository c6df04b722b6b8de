package io.kairo.core.tool.impl;

import io.kairo.core.cron.CronJob;
import io.kairo.core.cron.CronJobDefinition;
import io.kairo.core.cron.CronJobEvent;
import io.kairo.core.cron.CronPayload;
import io.kairo.core.cron.CronSchedule;
import io.kairo.core.cron.CronService;
import io.kairo.core.cron.CronServiceStatus;
import io.kairo.core.cron.NaturalTimeParser;
import io.kairo.core.tool.Tool;
import io.kairo.core.tool.ToolContext;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Lets a conversational agent manage its own reminders. Nothing in this repository runs an agent
 * loop; a host that does registers this tool in a {@link io.kairo.core.tool.ToolRegistry} and puts
 * the shared {@link CronService} into each {@link ToolContext} under {@value #SERVICE_KEY}, along
 * with the channel and chat id of the conversation so scheduled replies go back to it.
 */
public final class CronTool implements Tool {
    public static final String SERVICE_KEY = "cronService";
    private static final int MAX_NAME_LENGTH = 30;

    private final Clock clock;
    private final ZoneId zone;

    public CronTool() {
        this(Clock.systemUTC(), ZoneId.systemDefault());
    }

    public CronTool(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    public String name() {
        return "cron";
    }

    @Override
    public String description() {
        return "Schedule reminders and recurring tasks. Actions: add, list, remove, enable, disable, run, status";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "action", Map.of("type", "string", "enum", List.of("add", "list", "remove", "enable", "disable", "run", "status")),
                "message", Map.of("type", "string", "description", "What to do when the job fires"),
                "everySeconds", Map.of("type", "integer", "description", "Repeat interval in seconds"),
                "cronExpr", Map.of("type", "string", "description", "5-field cron expression, e.g. '0 9 * * *'"),
                "tz", Map.of("type", "string", "description", "IANA timezone for cronExpr"),
                "at", Map.of("type", "string", "description", "One-shot time: ISO instant, 'in 10m', 'tomorrow at 9am'"),
                "jobId", Map.of("type", "string")
            ),
            "required", List.of("action")
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        String action = text(input, "action").toLowerCase(Locale.ROOT);
        CronService cronService = context.service(SERVICE_KEY, CronService.class);
        if (cronService == null) {
            return "Error: cron service is not configured";
        }

        try {
            return switch (action) {
                case "add" -> add(cronService, input, context);
                case "list" -> list(cronService);
                case "remove" -> remove(cronService, input);
                case "enable" -> enable(cronService, input, true);
                case "disable" -> enable(cronService, input, false);
                case "run" -> run(cronService, input);
                case "status" -> status(cronService);
                default -> "Error: unsupported action: " + action;
            };
        } catch (Exception e) {
            return "Error: " + e.getMessage();
        }
    }

    private String add(CronService cronService, Map<String, Object> input, ToolContext context) {
        String message = text(input, "message");
        if (message.isBlank()) {
            return "Error: message is required for add";
        }
        if (isBlank(context.channel()) || isBlank(context.chatId())) {
            return "Error: no session context (channel/chatId) to deliver to";
        }

        String everySeconds = text(input, "everySeconds");
        String cronExpr = text(input, "cronExpr");
        String tz = text(input, "tz");
        String at = text(input, "at");
        if (!tz.isBlank() && cronExpr.isBlank()) {
            return "Error: tz can only be used with cronExpr";
        }

        CronSchedule schedule;
        boolean oneShot = false;
        if (!everySeconds.isBlank()) {
            long seconds = Long.parseLong(everySeconds);
            if (seconds <= 0) {
                return "Error: everySeconds must be > 0";
            }
            try {
                schedule = CronSchedule.every(Math.multiplyExact(seconds, 1000L));
            } catch (ArithmeticException e) {
                return "Error: everySeconds is too large";
            }
        } else if (!cronExpr.isBlank()) {
            schedule = CronSchedule.cron(cronExpr, tz);
        } else if (!at.isBlank()) {
            schedule = CronSchedule.at(new NaturalTimeParser(clock, zone).parseToEpochMs(at));
            oneShot = true;
        } else {
            return "Error: one of everySeconds, cronExpr or at is required";
        }

        String name = message.length() > MAX_NAME_LENGTH ? message.substring(0, MAX_NAME_LENGTH) : message;
        CronJob job = cronService.addJob(new CronJobDefinition(
            name,
            schedule,
            new CronPayload(message, true, context.channel(), context.chatId()),
            oneShot
        ));
        return "Created job '" + job.name() + "' (id: " + job.id() + ", " + job.schedule().describe() + ")";
    }

    private String list(CronService cronService) {
        List<CronJob> jobs = cronService.listJobs(true);
        if (jobs.isEmpty()) {
            return "No scheduled jobs.";
        }
        return "Scheduled jobs:\n" + jobs.stream()
            .map(job -> "- " + job.name()
                + " (id: " + job.id()
                + ", " + job.schedule().describe()
                + ", " + (job.enabled() ? "next " + formatTime(job.state().nextRunAtMs()) : "disabled")
                + ")")
            .collect(Collectors.joining("\n"));
    }

    private String remove(CronService cronService, Map<String, Object> input) {
        String jobId = text(input, "jobId");
        if (jobId.isBlank()) {
            return "Error: jobId is required for remove";
        }
        return cronService.removeJob(jobId) ? "Removed job " + jobId : "Error: job " + jobId + " not found";
    }

    private String enable(CronService cronService, Map<String, Object> input, boolean enabled) {
        String jobId = text(input, "jobId");
        if (jobId.isBlank()) {
            return "Error: jobId is required";
        }
        Optional<CronJob> job = cronService.enableJob(jobId, enabled);
        return job.map(value -> "Job '" + value.name() + "' " + (enabled ? "enabled" : "disabled"))
            .orElse("Error: job " + jobId + " not found");
    }

    private String run(CronService cronService, Map<String, Object> input) {
        String jobId = text(input, "jobId");
        if (jobId.isBlank()) {
            return "Error: jobId is required for run";
        }
        Optional<CronJobEvent> event = cronService.runJob(jobId);
        if (event.isEmpty()) {
            return "Error: job " + jobId + " not found";
        }
        CronJobEvent result = event.get();
        if (!result.success()) {
            return "Job " + jobId + " failed: " + result.error();
        }
        return result.response() == null ? "Job " + jobId + " executed" : "Job " + jobId + " executed: " + result.response();
    }

    private String status(CronService cronService) {
        CronServiceStatus status = cronService.getStatus();
        return "running=" + status.running()
            + ", jobs=" + status.totalJobs()
            + ", enabled=" + status.enabledJobs()
            + ", nextWake=" + formatTime(status.nextWakeAtMs());
    }

    private static String formatTime(Long epochMs) {
        return epochMs == null ? "-" : DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(epochMs));
    }

    private static String text(Map<String, Object> input, String key) {
        Object value = input.get(key);
        return value == null ? "" : String.valueOf(value).trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
