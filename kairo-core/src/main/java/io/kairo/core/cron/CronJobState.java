package io.kairo.core.cron;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronJobState(
    Long nextRunAtMs,
    Long lastRunAtMs,
    String lastStatus,
    String lastError
) {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    public static CronJobState initial(Long nextRunAtMs) {
        return new CronJobState(nextRunAtMs, null, null, null);
    }

    public CronJobState withNextRunAtMs(Long value) {
        return new CronJobState(value, lastRunAtMs, lastStatus, lastError);
    }

    public CronJobState withLastRunAtMs(Long value) {
        return new CronJobState(nextRunAtMs, value, lastStatus, lastError);
    }

    public CronJobState succeeded() {
        return new CronJobState(nextRunAtMs, lastRunAtMs, STATUS_OK, null);
    }

    public CronJobState failed(String error) {
        return new CronJobState(nextRunAtMs, lastRunAtMs, STATUS_ERROR, error);
    }
}
