package io.kairo.core.cron;

import java.util.Objects;

/**
 * Caller-supplied part of a new job; id, timestamps and state are assigned by {@link CronService#addJob}.
 */
public record CronJobDefinition(
    String name,
    CronSchedule schedule,
    CronPayload payload,
    boolean deleteAfterRun
) {

    public CronJobDefinition {
        Objects.requireNonNull(schedule, "schedule must not be null");
        name = name == null ? "" : name.trim();
        payload = payload == null ? CronPayload.message("") : payload;
    }

    public static CronJobDefinition of(String name, CronSchedule schedule, String message) {
        return new CronJobDefinition(name, schedule, CronPayload.message(message), false);
    }
}
