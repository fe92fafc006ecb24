package io.cronos.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class CronScheduleTest {
    private static final Instant NEW_YEAR = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldComputeNextOccurrenceOfSixFieldExpression() {
        CronSchedule schedule = CronSchedule.parse("0 30 9 * * *");

        assertThat(schedule.nextAfter(NEW_YEAR, ZoneOffset.UTC)).contains(Instant.parse("2026-01-01T09:30:00Z"));
    }

    @Test
    void shouldHonourSecondsField() {
        CronSchedule schedule = CronSchedule.parse("*/15 * * * * *");

        assertThat(schedule.nextAfter(NEW_YEAR, ZoneOffset.UTC)).contains(Instant.parse("2026-01-01T00:00:15Z"));
    }

    @Test
    void dayOfWeekZeroAndSevenShouldBothMeanSunday() {
        // 2026-01-01 is a Thursday
        Instant sunday = Instant.parse("2026-01-04T12:00:00Z");

        assertThat(CronSchedule.parse("0 0 12 * * 0").nextAfter(NEW_YEAR, ZoneOffset.UTC)).contains(sunday);
        assertThat(CronSchedule.parse("0 0 12 * * 7").nextAfter(NEW_YEAR, ZoneOffset.UTC)).contains(sunday);
    }

    @Test
    void shouldExpandMacros() {
        assertThat(CronSchedule.parse("@daily").nextAfter(NEW_YEAR, ZoneOffset.UTC))
            .contains(Instant.parse("2026-01-02T00:00:00Z"));
        assertThat(CronSchedule.parse("@hourly").nextAfter(NEW_YEAR, ZoneOffset.UTC))
            .contains(Instant.parse("2026-01-01T01:00:00Z"));
        assertThat(CronSchedule.parse("@monthly").nextAfter(NEW_YEAR, ZoneOffset.UTC))
            .contains(Instant.parse("2026-02-01T00:00:00Z"));
        assertThat(CronSchedule.parse("@daily").expression()).isEqualTo("@daily");
    }

    @Test
    void restrictedDayOfMonthAndDayOfWeekShouldMatchEitherDay() {
        CronSchedule firstOrMonday = CronSchedule.parse("0 0 0 1 * 1");

        // 2026-04-02 is a Thursday; the following Monday comes before May 1st
        assertThat(firstOrMonday.nextAfter(Instant.parse("2026-04-02T10:20:30Z"), ZoneOffset.UTC))
            .contains(Instant.parse("2026-04-06T00:00:00Z"));
        // 2026-05-01 is a Friday, ahead of Monday the 4th
        assertThat(firstOrMonday.nextAfter(Instant.parse("2026-04-28T00:00:00Z"), ZoneOffset.UTC))
            .contains(Instant.parse("2026-05-01T00:00:00Z"));
    }

    @Test
    void wildcardDayOfWeekShouldLeaveDayOfMonthAlone() {
        assertThat(CronSchedule.parse("0 0 0 15 * *").nextAfter(NEW_YEAR, ZoneOffset.UTC))
            .contains(Instant.parse("2026-01-15T00:00:00Z"));
        assertThat(CronSchedule.parse("0 0 0 * * 1").nextAfter(NEW_YEAR, ZoneOffset.UTC))
            .contains(Instant.parse("2026-01-05T00:00:00Z"));
    }

    @Test
    void everyShouldFireAtFixedInterval() {
        CronSchedule schedule = CronSchedule.parse("@every 5m");

        assertThat(schedule.nextAfter(NEW_YEAR, ZoneOffset.UTC)).contains(Instant.parse("2026-01-01T00:05:00Z"));
        assertThat(schedule.nextAfter(Instant.parse("2026-01-01T00:00:07.250Z"), ZoneOffset.UTC))
            .contains(Instant.parse("2026-01-01T00:05:07Z"));
        assertThat(schedule.description()).isEqualTo("every 5m");
        assertThat(schedule.expression()).isEqualTo("@every 5m");
    }

    @Test
    void everyShouldAcceptCompoundDurations() {
        assertThat(CronSchedule.parse("@every 1h30m").nextAfter(NEW_YEAR, ZoneOffset.UTC))
            .contains(Instant.parse("2026-01-01T01:30:00Z"));
        assertThat(CronSchedule.parse("@every 1.5h").nextAfter(NEW_YEAR, ZoneOffset.UTC))
            .contains(Instant.parse("2026-01-01T01:30:00Z"));
        assertThat(CronSchedule.parse("@every 500ms").nextAfter(NEW_YEAR, ZoneOffset.UTC))
            .contains(Instant.parse("2026-01-01T00:00:01Z"));
        assertThat(CronSchedule.parseDuration("@every 2m30s", "2m30s")).isEqualTo(Duration.ofSeconds(150));
    }

    @Test
    void everyShouldRejectMissingOrInvalidDurations() {
        assertThatThrownBy(() -> CronSchedule.parse("@every")).isInstanceOf(ScheduleException.class);
        assertThatThrownBy(() -> CronSchedule.parse("@every 5"))
            .isInstanceOf(ScheduleException.class)
            .hasMessageContaining("@every 5");
        assertThatThrownBy(() -> CronSchedule.parse("@every 5x")).isInstanceOf(ScheduleException.class);
        assertThatThrownBy(() -> CronSchedule.parse("@every 0s")).isInstanceOf(ScheduleException.class);
        assertThatThrownBy(() -> CronSchedule.parse("@every m5")).isInstanceOf(ScheduleException.class);
    }

    @Test
    void shouldEvaluateInGivenZone() {
        CronSchedule schedule = CronSchedule.parse("0 0 9 * * *");

        assertThat(schedule.nextAfter(NEW_YEAR, ZoneId.of("Europe/Berlin")))
            .contains(Instant.parse("2026-01-01T08:00:00Z"));
    }

    @Test
    void shouldRejectMalformedExpressions() {
        assertThatThrownBy(() -> CronSchedule.parse("")).isInstanceOf(ScheduleException.class);
        assertThatThrownBy(() -> CronSchedule.parse(null)).isInstanceOf(ScheduleException.class);
        assertThatThrownBy(() -> CronSchedule.parse("0 9 * * *"))
            .isInstanceOf(ScheduleException.class)
            .hasMessageContaining("0 9 * * *");
        assertThatThrownBy(() -> CronSchedule.parse("0 60 * * * *")).isInstanceOf(ScheduleException.class);
        assertThatThrownBy(() -> CronSchedule.parse("@fortnightly")).isInstanceOf(ScheduleException.class);
    }

    @Test
    void scheduleExceptionShouldCarryExpression() {
        assertThatThrownBy(() -> CronSchedule.parse("a b c d e f"))
            .isInstanceOfSatisfying(ScheduleException.class, e -> assertThat(e.expression()).isEqualTo("a b c d e f"));
    }

    @Test
    void shouldDescribeExpressions() {
        assertThat(CronSchedule.describe("0 30 9 * * *")).isNotBlank();
        assertThat(CronSchedule.parse("@weekly").description()).isNotBlank();
    }
}
