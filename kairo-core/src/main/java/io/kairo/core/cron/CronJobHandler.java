package io.kairo.core.cron;

import java.util.concurrent.CompletionStage;

/**
 * Host-supplied behavior for a firing job, typically an agent turn.
 * The stage completes with an optional response (may be {@code null}); throwing or completing
 * exceptionally marks the run as failed.
 */
@FunctionalInterface
public interface CronJobHandler {
    CompletionStage<String> handle(CronJob job) throws Exception;
}
