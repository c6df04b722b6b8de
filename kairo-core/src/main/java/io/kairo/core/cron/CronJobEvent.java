package io.kairo.core.cron;

/**
 * Outcome of one job execution, delivered to every {@link CronJobListener}.
 * {@code job} is the snapshot after results and rescheduling were applied.
 */
public record CronJobEvent(
    CronJob job,
    boolean success,
    String response,
    String error
) {
}
