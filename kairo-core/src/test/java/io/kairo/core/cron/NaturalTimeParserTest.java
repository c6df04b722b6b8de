package io.kairo.core.cron;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class NaturalTimeParserTest {
    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private final NaturalTimeParser parser = new NaturalTimeParser(Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.UTC);

    private static long ms(String instant) {
        return Instant.parse(instant).toEpochMilli();
    }

    @Test
    void shouldParseRelativeExpressions() {
        assertThat(parser.parseToEpochMs("now")).isEqualTo(NOW.toEpochMilli());
        assertThat(parser.parseToEpochMs("in 30s")).isEqualTo(NOW.toEpochMilli() + 30_000);
        assertThat(parser.parseToEpochMs("in 10m")).isEqualTo(ms("2026-03-02T10:10:00Z"));
        assertThat(parser.parseToEpochMs("In 2 Hours")).isEqualTo(ms("2026-03-02T12:00:00Z"));
        assertThat(parser.parseToEpochMs("in 3 days")).isEqualTo(ms("2026-03-05T10:00:00Z"));
        assertThat(parser.parseToEpochMs("in 1w")).isEqualTo(ms("2026-03-09T10:00:00Z"));
    }

    @Test
    void shouldParseDayNames() {
        assertThat(parser.parseToEpochMs("tomorrow")).isEqualTo(ms("2026-03-03T09:00:00Z"));
        assertThat(parser.parseToEpochMs("tomorrow at 9am")).isEqualTo(ms("2026-03-03T09:00:00Z"));
        assertThat(parser.parseToEpochMs("today at 5:30pm")).isEqualTo(ms("2026-03-02T17:30:00Z"));
        assertThat(parser.parseToEpochMs("today at 18:45")).isEqualTo(ms("2026-03-02T18:45:00Z"));
    }

    @Test
    void shouldRollBareTimesToNextOccurrence() {
        assertThat(parser.parseToEpochMs("at 3pm")).isEqualTo(ms("2026-03-02T15:00:00Z"));
        assertThat(parser.parseToEpochMs("9am")).isEqualTo(ms("2026-03-03T09:00:00Z"));
        assertThat(parser.parseToEpochMs("10:00")).isEqualTo(ms("2026-03-03T10:00:00Z"));
        assertThat(parser.parseToEpochMs("12am")).isEqualTo(ms("2026-03-03T00:00:00Z"));
    }

    @Test
    void shouldParseAbsoluteTimes() {
        assertThat(parser.parseToEpochMs("2026-04-01T08:15:00Z")).isEqualTo(ms("2026-04-01T08:15:00Z"));
        assertThat(parser.parseToEpochMs("2026-04-01T08:15:00+02:00")).isEqualTo(ms("2026-04-01T06:15:00Z"));
        assertThat(parser.parseToEpochMs("2026-04-01 08:15")).isEqualTo(ms("2026-04-01T08:15:00Z"));
        assertThat(parser.parseToEpochMs("2026-04-01T08:15")).isEqualTo(ms("2026-04-01T08:15:00Z"));
        assertThat(parser.parseToEpochMs("2026-04-01")).isEqualTo(ms("2026-04-01T09:00:00Z"));
    }

    @Test
    void shouldInterpretLocalTimesInConfiguredZone() {
        NaturalTimeParser tokyo = new NaturalTimeParser(Clock.fixed(NOW, ZoneOffset.UTC), ZoneId.of("Asia/Tokyo"));

        // 10:00Z is 19:00 in Tokyo
        assertThat(tokyo.parseToEpochMs("tomorrow at 8am")).isEqualTo(ms("2026-03-02T23:00:00Z"));
        assertThat(tokyo.parseToEpochMs("2026-04-01 09:00")).isEqualTo(ms("2026-04-01T00:00:00Z"));
    }

    @Test
    void shouldRejectUnknownExpressions() {
        assertThatThrownBy(() -> parser.parseToEpochMs("next blue moon"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("next blue moon");
        assertThatThrownBy(() -> parser.parseToEpochMs("today at 25:00"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parseToEpochMs("13pm"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parseToEpochMs("9:75am"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("invalid time: 9:75am");
        assertThatThrownBy(() -> parser.parseToEpochMs("today at 11:60pm"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parseToEpochMs("in 99999999999999999 weeks"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("too large");
        assertThatThrownBy(() -> parser.parseToEpochMs("in 9223372036854775807s"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parseToEpochMs(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
