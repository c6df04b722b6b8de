package io.kairo.core.cron;

import java.util.List;

public record CronStoreDocument(int version, List<CronJob> jobs) {
}
