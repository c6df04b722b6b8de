package io.kairo.core.cron;

/**
 * Single outstanding one-shot wake-up. Scheduling replaces whatever was pending.
 */
public interface WakeTimer extends AutoCloseable {
    void schedule(long delayMs, Runnable wake);

    void cancel();

    @Override
    void close();
}
