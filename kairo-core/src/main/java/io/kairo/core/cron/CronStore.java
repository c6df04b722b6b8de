package io.kairo.core.cron;

import java.util.List;

/**
 * Persistence boundary for the job collection. Implementations report their own failures:
 * {@link #load()} falls back to an empty list and {@link #save(List)} logs instead of throwing.
 */
public interface CronStore {
    List<CronJob> load();

    void save(List<CronJob> jobs);
}
