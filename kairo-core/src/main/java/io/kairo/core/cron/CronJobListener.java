package io.kairo.core.cron;

@FunctionalInterface
public interface CronJobListener {
    void onJobExecuted(CronJobEvent event);
}
