package io.dispatch4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronExpressionsTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void everyThirtySecondsFiresOnTheHalfMinute() {
        CronExpressions.Schedule s = CronExpressions.parse("*/30 * * * * *", UTC);

        assertThat(s.nextFireAfter(Instant.parse("2026-01-01T00:00:05Z")))
                .isEqualTo(Instant.parse("2026-01-01T00:00:30Z"));
        assertThat(s.nextFireAfter(Instant.parse("2026-01-01T00:00:30Z")))
                .isEqualTo(Instant.parse("2026-01-01T00:01:00Z"));
    }

    @Test
    void topOfEveryMinute() {
        CronExpressions.Schedule s = CronExpressions.parse("0 * * * * *", UTC);

        assertThat(s.nextFireAfter(Instant.parse("2026-01-01T10:15:42Z")))
                .isEqualTo(Instant.parse("2026-01-01T10:16:00Z"));
    }

    @Test
    void normalizeCronAddsQuestionMarkToUnrestrictedDayField() {
        assertThat(CronExpressions.normalizeCron("0 0 2 * * *")).containsExactly("0 0 2 * * ?");
        assertThat(CronExpressions.normalizeCron("0 0 2 15 * *")).containsExactly("0 0 2 15 * ?");
        assertThat(CronExpressions.normalizeCron("0 0 2 * * 1-5")).containsExactly("0 0 2 ? * 2-6");
    }

    @Test
    void normalizeCronSplitsSpecsRestrictingBothDayFields() {
        assertThat(CronExpressions.normalizeCron("0 0 12 1 * MON"))
                .containsExactly("0 0 12 1 * ?", "0 0 12 ? * MON");
        assertThat(CronExpressions.normalizeCron("0 0 0 1,15 * 1-5"))
                .containsExactly("0 0 0 1,15 * ?", "0 0 0 ? * 2-6");
    }

    @Test
    void restrictedDayFieldsFireWhenEitherMatches() {
        // 2026-01-01 is a Thursday, 2026-01-05 a Monday
        CronExpressions.Schedule s = CronExpressions.parse("0 0 12 1 * MON", UTC);

        assertThat(s.nextFireAfter(Instant.parse("2025-12-31T13:00:00Z")))
                .isEqualTo(Instant.parse("2026-01-01T12:00:00Z"));
        assertThat(s.nextFireAfter(Instant.parse("2026-01-01T12:00:00Z")))
                .isEqualTo(Instant.parse("2026-01-05T12:00:00Z"));
        assertThat(s.nextFireAfter(Instant.parse("2026-01-26T12:00:00Z")))
                .isEqualTo(Instant.parse("2026-02-01T12:00:00Z"));
    }

    @Test
    void wildcardStepInDayFieldRequiresBothToMatch() {
        // odd days of the month that are also weekdays; 2026-01-03 is a Saturday
        CronExpressions.Schedule s = CronExpressions.parse("0 0 8 */2 * 1-5", UTC);

        assertThat(s.nextFireAfter(Instant.parse("2026-01-01T09:00:00Z")))
                .isEqualTo(Instant.parse("2026-01-05T08:00:00Z"));
        assertThat(s.nextFireAfter(Instant.parse("2026-01-05T08:00:00Z")))
                .isEqualTo(Instant.parse("2026-01-07T08:00:00Z"));
    }

    @Test
    void everyFiresAtFixedRateAlignedToSeconds() {
        CronExpressions.Schedule s = CronExpressions.parse("@every 1h30m", UTC);

        assertThat(s.nextFireAfter(Instant.parse("2026-01-01T00:00:00.400Z")))
                .isEqualTo(Instant.parse("2026-01-01T01:30:00Z"));
        assertThat(CronExpressions.parse("@every 5m", UTC).nextFireAfter(Instant.parse("2026-01-01T00:00:10Z")))
                .isEqualTo(Instant.parse("2026-01-01T00:05:10Z"));
        assertThat(CronExpressions.parse("@every 100ms", UTC).nextFireAfter(Instant.parse("2026-01-01T00:00:10Z")))
                .isEqualTo(Instant.parse("2026-01-01T00:00:11Z"));
    }

    @Test
    void parsesGoStyleDurations() {
        assertThat(CronExpressions.parseDuration("1h30m")).isEqualTo(Duration.ofMinutes(90));
        assertThat(CronExpressions.parseDuration("1.5h")).isEqualTo(Duration.ofMinutes(90));
        assertThat(CronExpressions.parseDuration("2m3.5s")).isEqualTo(Duration.ofMillis(123_500));
        assertThat(CronExpressions.parseDuration("250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(CronExpressions.parseDuration("0")).isEqualTo(Duration.ZERO);
        assertThat(CronExpressions.parseDuration("-5s")).isEqualTo(Duration.ofSeconds(-5));

        assertThatThrownBy(() -> CronExpressions.parseDuration("5")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CronExpressions.parseDuration("5d")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CronExpressions.parseDuration("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void zonePrefixOverridesDefaultZone() {
        CronExpressions.Schedule s = CronExpressions.parse("CRON_TZ=Asia/Taipei 0 0 9 * * *", UTC);

        assertThat(s.nextFireAfter(Instant.parse("2026-01-01T00:00:00Z")))
                .isEqualTo(Instant.parse("2026-01-01T01:00:00Z"));
        assertThat(CronExpressions.isValid("TZ=Nowhere/Special 0 0 9 * * *")).isFalse();
    }

    @Test
    void dayOfWeekZeroAndSevenMeanSunday() {
        assertThat(CronExpressions.shiftDaysOfWeek("0")).isEqualTo("1");
        assertThat(CronExpressions.shiftDaysOfWeek("7")).isEqualTo("1");
        assertThat(CronExpressions.shiftDaysOfWeek("0,6")).isEqualTo("1,7");
        assertThat(CronExpressions.shiftDaysOfWeek("1-5/2")).isEqualTo("2-6/2");
        assertThat(CronExpressions.shiftDaysOfWeek("MON-FRI")).isEqualTo("MON-FRI");

        // 2026-01-04 is a Sunday
        CronExpressions.Schedule sundays = CronExpressions.parse("0 0 9 * * 0", UTC);
        assertThat(sundays.nextFireAfter(Instant.parse("2026-01-01T00:00:00Z")))
                .isEqualTo(Instant.parse("2026-01-04T09:00:00Z"));
    }

    @Test
    void descriptorsExpandToSixFields() {
        assertThat(CronExpressions.normalizeCron("@hourly")).containsExactly("0 0 * * * ?");
        assertThat(CronExpressions.normalizeCron("@DAILY")).containsExactly("0 0 0 * * ?");

        CronExpressions.Schedule weekly = CronExpressions.parse("@weekly", UTC);
        assertThat(weekly.nextFireAfter(Instant.parse("2026-01-01T00:00:00Z")))
                .isEqualTo(Instant.parse("2026-01-04T00:00:00Z"));
    }

    @Test
    void scheduleIsEvaluatedInItsZone() {
        CronExpressions.Schedule s = CronExpressions.parse("0 0 9 * * *", ZoneId.of("Asia/Taipei"));

        assertThat(s.nextFireAfter(Instant.parse("2026-01-01T00:00:00Z")))
                .isEqualTo(Instant.parse("2026-01-01T01:00:00Z"));
    }

    @Test
    void rejectsMalformedSpecs() {
        assertThatThrownBy(() -> CronExpressions.normalizeCron("*/5 * * * *"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 6 fields");
        assertThatThrownBy(() -> CronExpressions.normalizeCron("@fortnightly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported cron descriptor");
        assertThatThrownBy(() -> CronExpressions.parse("@every soon", UTC))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CronExpressions.parse("61 * * * * *", UTC))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid cron expression");
    }

    @Test
    void isValidRecognizesSpecs() {
        assertThat(CronExpressions.isValid("*/30 * * * * *")).isTrue();
        assertThat(CronExpressions.isValid("0 */10 * * * MON-FRI")).isTrue();
        assertThat(CronExpressions.isValid("0 0 12 1 * MON")).isTrue();
        assertThat(CronExpressions.isValid("0 0 0 1,15 * 1-5")).isTrue();
        assertThat(CronExpressions.isValid("@every 5m")).isTrue();
        assertThat(CronExpressions.isValid("@every 1h30m")).isTrue();
        assertThat(CronExpressions.isValid("not a cron")).isFalse();
        assertThat(CronExpressions.isValid("")).isFalse();
    }
}
