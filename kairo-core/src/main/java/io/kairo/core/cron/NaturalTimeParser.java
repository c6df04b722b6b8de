package io.kairo.core.cron;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the one-shot times people type ("in 10m", "tomorrow at 9am", "2026-03-01 08:30",
 * ISO instants) into epoch milliseconds for {@link CronSchedule#at(long)}.
 */
public final class NaturalTimeParser {
    private static final Pattern RELATIVE = Pattern.compile(
        "^in\\s+(\\d+)\\s*(s|secs?|seconds?|m|mins?|minutes?|h|hrs?|hours?|d|days?|w|weeks?)$"
    );
    private static final Pattern DAY_AT = Pattern.compile("^(today|tomorrow)(?:\\s+at\\s+(.+))?$");
    private static final Pattern AT_TIME = Pattern.compile("^(?:at\\s+)?(\\d{1,2}(?::\\d{2})?\\s*(?:am|pm)?)$");
    private static final Pattern MERIDIEM = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?(am|pm)$");
    private static final Pattern CLOCK = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?$");
    private static final LocalTime DEFAULT_TIME = LocalTime.of(9, 0);
    private static final DateTimeFormatter DATE_TIME_SPACE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final Clock clock;
    private final ZoneId zone;

    public NaturalTimeParser(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    public long parseToEpochMs(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("time expression is required");
        }
        String raw = expression.trim();
        String normalized = raw.toLowerCase(Locale.ROOT);
        ZonedDateTime now = clock.instant().atZone(zone);

        if ("now".equals(normalized)) {
            return now.toInstant().toEpochMilli();
        }

        Matcher relative = RELATIVE.matcher(normalized);
        if (relative.matches()) {
            try {
                long amount = Long.parseLong(relative.group(1));
                long seconds = Math.multiplyExact(amount, unitSeconds(relative.group(2)));
                return now.toInstant().plusSeconds(seconds).toEpochMilli();
            } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
                throw new IllegalArgumentException("time offset too large: " + raw, e);
            }
        }

        Matcher dayAt = DAY_AT.matcher(normalized);
        if (dayAt.matches()) {
            LocalDate date = now.toLocalDate();
            if ("tomorrow".equals(dayAt.group(1))) {
                date = date.plusDays(1);
            }
            LocalTime time = dayAt.group(2) == null ? DEFAULT_TIME : parseTime(dayAt.group(2));
            return toEpochMs(LocalDateTime.of(date, time));
        }

        Matcher atTime = AT_TIME.matcher(normalized);
        if (atTime.matches()) {
            LocalTime time = parseTime(atTime.group(1));
            LocalDateTime candidate = LocalDateTime.of(now.toLocalDate(), time);
            if (!candidate.atZone(zone).isAfter(now)) {
                candidate = candidate.plusDays(1);
            }
            return toEpochMs(candidate);
        }

        return absolute(raw)
            .orElseThrow(() -> new IllegalArgumentException("unable to parse time expression: " + expression));
    }

    private Optional<Long> absolute(String raw) {
        List<Function<String, Long>> formats = List.of(
            value -> Instant.parse(value).toEpochMilli(),
            value -> ZonedDateTime.parse(value).toInstant().toEpochMilli(),
            value -> toEpochMs(LocalDateTime.parse(value, DATE_TIME_SPACE)),
            value -> toEpochMs(LocalDateTime.parse(value)),
            value -> toEpochMs(LocalDate.parse(value).atTime(DEFAULT_TIME))
        );
        for (Function<String, Long> format : formats) {
            try {
                return Optional.of(format.apply(raw));
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return Optional.empty();
    }

    private long toEpochMs(LocalDateTime dateTime) {
        return dateTime.atZone(zone).toInstant().toEpochMilli();
    }

    private static long unitSeconds(String unit) {
        return switch (unit.charAt(0)) {
            case 's' -> 1;
            case 'm' -> 60;
            case 'h' -> 3_600;
            case 'd' -> 86_400;
            case 'w' -> 604_800;
            default -> throw new IllegalArgumentException("unsupported time unit: " + unit);
        };
    }

    private static LocalTime parseTime(String token) {
        String value = token.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        Matcher meridiem = MERIDIEM.matcher(value);
        if (meridiem.matches()) {
            int hour = Integer.parseInt(meridiem.group(1));
            if (hour < 1 || hour > 12) {
                throw new IllegalArgumentException("invalid time: " + token);
            }
            int minute = meridiem.group(2) == null ? 0 : Integer.parseInt(meridiem.group(2));
            hour = hour % 12 + ("pm".equals(meridiem.group(3)) ? 12 : 0);
            try {
                return LocalTime.of(hour, minute);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("invalid time: " + token, e);
            }
        }
        Matcher clockTime = CLOCK.matcher(value);
        if (clockTime.matches()) {
            int hour = Integer.parseInt(clockTime.group(1));
            int minute = clockTime.group(2) == null ? 0 : Integer.parseInt(clockTime.group(2));
            try {
                return LocalTime.of(hour, minute);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("invalid time: " + token, e);
            }
        }
        throw new IllegalArgumentException("invalid time format: " + token);
    }
}
