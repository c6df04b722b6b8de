package io.kairo.core.cron;

public enum ServiceState {
    STOPPED,
    STARTING,
    RUNNING
}
