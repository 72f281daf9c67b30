package io.dispatch4j.cron;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CronGenerationTest {

    @Test
    void delayKeepsSubMillisecondRemainder() {
        Instant now = Instant.parse("2026-01-01T00:00:00.998600Z");
        Instant next = Instant.parse("2026-01-01T00:00:01Z");

        assertThat(CronGeneration.delayNanos(now, next)).isEqualTo(1_400_000L);
    }

    @Test
    void delayIsNeverNegative() {
        Instant now = Instant.parse("2026-01-01T00:00:01.000500Z");

        assertThat(CronGeneration.delayNanos(now, Instant.parse("2026-01-01T00:00:01Z"))).isZero();
    }

    @Test
    void farFutureDelaySaturates() {
        assertThat(CronGeneration.delayNanos(Instant.EPOCH, Instant.parse("2999-01-01T00:00:00Z")))
                .isEqualTo(Long.MAX_VALUE);
    }
}
