package io.kairo.core.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * When a job fires. Only the fields belonging to {@link #kind()} are meaningful:
 * {@code atMs} for {@link ScheduleKind#AT}, {@code everyMs} for {@link ScheduleKind#EVERY},
 * {@code expr} and the optional IANA zone {@code tz} for {@link ScheduleKind#CRON}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronSchedule(
    ScheduleKind kind,
    Long atMs,
    Long everyMs,
    String expr,
    String tz
) {

    public CronSchedule {
        Objects.requireNonNull(kind, "schedule kind must not be null");
    }

    /** Stored schedules without a kind read as {@link ScheduleKind#EVERY}. */
    @JsonCreator
    static CronSchedule fromJson(
        @JsonProperty("kind") ScheduleKind kind,
        @JsonProperty("atMs") Long atMs,
        @JsonProperty("everyMs") Long everyMs,
        @JsonProperty("expr") String expr,
        @JsonProperty("tz") String tz
    ) {
        return new CronSchedule(kind == null ? ScheduleKind.EVERY : kind, atMs, everyMs, expr, tz);
    }

    public static CronSchedule at(long atMs) {
        return new CronSchedule(ScheduleKind.AT, atMs, null, null, null);
    }

    public static CronSchedule every(long everyMs) {
        return new CronSchedule(ScheduleKind.EVERY, null, everyMs, null, null);
    }

    public static CronSchedule cron(String expr, String tz) {
        return new CronSchedule(ScheduleKind.CRON, null, null, expr, tz == null || tz.isBlank() ? null : tz.trim());
    }

    public String describe() {
        return switch (kind) {
            case AT -> atMs == null ? "once" : "once at " + DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(atMs));
            case EVERY -> everyMs == null ? "every ?" : "every " + formatInterval(everyMs);
            case CRON -> tz == null ? "cron " + expr : "cron " + expr + " (" + tz + ")";
        };
    }

    private static String formatInterval(long millis) {
        if (millis % 1000 != 0) {
            return millis + "ms";
        }
        return (millis / 1000) + "s";
    }
}
