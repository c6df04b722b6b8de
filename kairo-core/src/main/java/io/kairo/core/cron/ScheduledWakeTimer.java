package io.kairo.core.cron;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link WakeTimer} backed by a single daemon thread, so wake-ups never overlap each other.
 */
public final class ScheduledWakeTimer implements WakeTimer {
    static final long MAX_DELAY_MS = TimeUnit.NANOSECONDS.toMillis(Long.MAX_VALUE >> 1);

    private final ScheduledExecutorService executor;
    private ScheduledFuture<?> pending;

    public ScheduledWakeTimer() {
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "kairo-cron-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public synchronized void schedule(long delayMs, Runnable wake) {
        cancel();
        long delay = Math.min(Math.max(0L, delayMs), MAX_DELAY_MS);
        pending = executor.schedule(wake, delay, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void cancel() {
        if (pending != null) {
            // a wake already in progress is left to finish
            pending.cancel(false);
            pending = null;
        }
    }

    @Override
    public synchronized void close() {
        cancel();
        executor.shutdown();
    }
}
