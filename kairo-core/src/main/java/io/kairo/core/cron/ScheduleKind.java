package io.kairo.core.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ScheduleKind {
    AT("at"),
    EVERY("every"),
    CRON("cron");

    private final String value;

    ScheduleKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Case-insensitive; anything unrecognised reads as {@link #EVERY}.
     */
    @JsonCreator
    public static ScheduleKind fromValue(String raw) {
        if (raw == null) {
            return EVERY;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ScheduleKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        return EVERY;
    }
}
