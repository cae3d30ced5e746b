package com.delta.pagetracker.crawl.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronSchedulesTest {

    @Test
    void fiveFieldExpressionGetsZeroSeconds() {
        assertThat(CronSchedules.toSpringExpression("0 9 * * 1")).isEqualTo("0 0 9 * * 1");
        assertThat(CronSchedules.toSpringExpression("  */15   *  * * * ")).isEqualTo("0 */15 * * * *");
    }

    @Test
    void rejectsWrongFieldCountAndGarbage() {
        assertThatThrownBy(() -> CronSchedules.toSpringExpression("0 0 9 * * 1"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("5 fields");
        assertThat(CronSchedules.isValid("not a cron at all")).isFalse();
        assertThat(CronSchedules.isValid("61 * * * *")).isFalse();
        assertThat(CronSchedules.isValid(null)).isFalse();
        assertThat(CronSchedules.isValid("30 2 * * *")).isTrue();
    }

    @Test
    void nextRunIsStrictlyAfterReferenceInZone() {
        Instant from = Instant.parse("2024-03-04T09:00:00Z");

        assertThat(CronSchedules.nextRun("0 9 * * *", ZoneOffset.UTC, from))
            .isEqualTo(Instant.parse("2024-03-05T09:00:00Z"));
        assertThat(CronSchedules.nextRun("0 9 * * *", ZoneId.of("Europe/Berlin"), from))
            .isEqualTo(Instant.parse("2024-03-05T08:00:00Z"));
        assertThat(CronSchedules.nextRun("bogus", ZoneOffset.UTC, from)).isNull();
    }
}
