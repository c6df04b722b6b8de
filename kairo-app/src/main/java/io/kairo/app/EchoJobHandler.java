package io.kairo.app;

import io.kairo.core.cron.CronJob;
import io.kairo.core.cron.CronJobHandler;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Answers every job with its own message. Stands in for the agent turn until one is wired in.
 */
final class EchoJobHandler implements CronJobHandler {

    @Override
    public CompletionStage<String> handle(CronJob job) {
        String message = job.payload().message();
        return CompletableFuture.completedFuture(message == null || message.isBlank() ? null : message.trim());
    }
}
