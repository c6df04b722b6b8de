package io.kairo.core.cron;

import java.util.ArrayList;
import java.util.List;

final class InMemoryCronStore implements CronStore {
    private List<CronJob> jobs = new ArrayList<>();

    @Override
    public synchronized List<CronJob> load() {
        return List.copyOf(jobs);
    }

    @Override
    public synchronized void save(List<CronJob> jobs) {
        this.jobs = new ArrayList<>(jobs);
    }
}
