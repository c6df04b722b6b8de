package io.kairo.core.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the next fire time of a {@link CronSchedule}. Never throws: a schedule that cannot be
 * evaluated has no next run.
 */
public final class ScheduleEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleEvaluator.class);
    private static final int MAX_CRON_LOOKAHEAD = 3;

    private final CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private final ZoneId defaultZone;

    public ScheduleEvaluator() {
        this(ZoneId.systemDefault());
    }

    public ScheduleEvaluator(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    public OptionalLong nextRun(CronSchedule schedule, long nowMs) {
        if (schedule == null) {
            return OptionalLong.empty();
        }
        return switch (schedule.kind()) {
            case AT -> schedule.atMs() != null && schedule.atMs() > nowMs
                ? OptionalLong.of(schedule.atMs())
                : OptionalLong.empty();
            case EVERY -> schedule.everyMs() != null && schedule.everyMs() > 0
                ? OptionalLong.of(nowMs + schedule.everyMs())
                : OptionalLong.empty();
            case CRON -> nextCronRun(schedule, nowMs);
        };
    }

    /**
     * Rejects schedules that could never produce a run.
     *
     * @throws IllegalArgumentException with a user-facing message
     */
    public void validate(CronSchedule schedule) {
        if (schedule == null) {
            throw new IllegalArgumentException("schedule is required");
        }
        switch (schedule.kind()) {
            case AT -> {
                if (schedule.atMs() == null) {
                    throw new IllegalArgumentException("atMs is required for an 'at' schedule");
                }
            }
            case EVERY -> {
                if (schedule.everyMs() == null || schedule.everyMs() <= 0) {
                    throw new IllegalArgumentException("everyMs must be > 0");
                }
            }
            case CRON -> {
                if (schedule.tz() != null && !schedule.tz().isBlank()) {
                    try {
                        ZoneId.of(schedule.tz().trim());
                    } catch (DateTimeException e) {
                        throw new IllegalArgumentException("Invalid timezone: " + schedule.tz(), e);
                    }
                }
                parse(schedule.expr());
            }
        }
    }

    private OptionalLong nextCronRun(CronSchedule schedule, long nowMs) {
        try {
            ExecutionTime executionTime = ExecutionTime.forCron(parse(schedule.expr()));
            ZonedDateTime cursor = Instant.ofEpochMilli(nowMs).atZone(resolveZone(schedule.tz()));
            for (int i = 0; i < MAX_CRON_LOOKAHEAD; i++) {
                Optional<ZonedDateTime> next = executionTime.nextExecution(cursor);
                if (next.isEmpty()) {
                    return OptionalLong.empty();
                }
                long nextMs = next.get().toInstant().toEpochMilli();
                if (nextMs > nowMs) {
                    return OptionalLong.of(nextMs);
                }
                cursor = next.get();
            }
            return OptionalLong.empty();
        } catch (RuntimeException e) {
            LOG.warn(
                "Failed to compute next run for cron expression '{}' (tz={}): {}",
                schedule.expr(),
                schedule.tz(),
                e.getMessage()
            );
            return OptionalLong.empty();
        }
    }

    private Cron parse(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new IllegalArgumentException("cron expression is required");
        }
        try {
            return parser.parse(expr.trim()).validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + expr + "': " + e.getMessage(), e);
        }
    }

    private ZoneId resolveZone(String tz) {
        if (tz == null || tz.isBlank()) {
            return defaultZone;
        }
        return ZoneId.of(tz.trim());
    }
}
