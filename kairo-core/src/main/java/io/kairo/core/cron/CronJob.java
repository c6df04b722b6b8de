package io.kairo.core.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronJob(
    String id,
    String name,
    boolean enabled,
    CronSchedule schedule,
    CronPayload payload,
    CronJobState state,
    long createdAtMs,
    long updatedAtMs,
    boolean deleteAfterRun
) {

    public CronJob {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        Objects.requireNonNull(schedule, "job schedule must not be null");
        name = name == null ? "" : name;
        payload = payload == null ? CronPayload.message("") : payload;
        state = state == null ? CronJobState.initial(null) : state;
    }

    /**
     * Reads a stored record, filling what older or hand-edited files leave out: jobs are enabled
     * unless they say otherwise, and a missing schedule becomes an interval with no period, which
     * never fires.
     */
    @JsonCreator
    static CronJob fromJson(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("schedule") CronSchedule schedule,
        @JsonProperty("payload") CronPayload payload,
        @JsonProperty("state") CronJobState state,
        @JsonProperty("createdAtMs") Long createdAtMs,
        @JsonProperty("updatedAtMs") Long updatedAtMs,
        @JsonProperty("deleteAfterRun") Boolean deleteAfterRun
    ) {
        return new CronJob(
            id,
            name,
            enabled == null || enabled,
            schedule == null ? new CronSchedule(ScheduleKind.EVERY, null, null, null, null) : schedule,
            payload,
            state,
            createdAtMs == null ? 0L : createdAtMs,
            updatedAtMs == null ? 0L : updatedAtMs,
            deleteAfterRun != null && deleteAfterRun
        );
    }

    public CronJob withEnabled(boolean value) {
        return new CronJob(id, name, value, schedule, payload, state, createdAtMs, updatedAtMs, deleteAfterRun);
    }

    public CronJob withState(CronJobState value) {
        return new CronJob(id, name, enabled, schedule, payload, value, createdAtMs, updatedAtMs, deleteAfterRun);
    }

    public CronJob withUpdatedAtMs(long value) {
        return new CronJob(id, name, enabled, schedule, payload, state, createdAtMs, value, deleteAfterRun);
    }

    /** Enabled and scheduled at or before {@code nowMs}. */
    public boolean dueAt(long nowMs) {
        return enabled && state.nextRunAtMs() != null && state.nextRunAtMs() <= nowMs;
    }
}
