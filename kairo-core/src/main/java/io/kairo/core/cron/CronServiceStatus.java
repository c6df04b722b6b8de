package io.kairo.core.cron;

public record CronServiceStatus(
    boolean running,
    int totalJobs,
    int enabledJobs,
    Long nextWakeAtMs
) {
}
