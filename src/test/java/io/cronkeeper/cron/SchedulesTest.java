package io.cronkeeper.cron;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class SchedulesTest {

    private static final long NOW = Instant.parse("2024-01-01T10:00:00Z").toEpochMilli();

    @Test
    void shouldAlignIntervalToAnchor() {
        long anchor = NOW - 25_000;
        long next = Schedules.computeNextRun(new Schedule.Every(10_000, anchor), NOW).orElseThrow();

        assertEquals(NOW + 5_000, next);
        assertEquals(0, (next - anchor) % 10_000);
        assertTrue(next > NOW);
    }

    @Test
    void shouldStepPastNowWhenExactlyOnBoundary() {
        long anchor = NOW - 20_000;
        assertEquals(OptionalLong.of(NOW + 10_000), Schedules.computeNextRun(new Schedule.Every(10_000, anchor), NOW));
    }

    @Test
    void shouldReturnFutureAnchorAsFirstRun() {
        assertEquals(OptionalLong.of(NOW + 90_000), Schedules.computeNextRun(new Schedule.Every(60_000, NOW + 90_000), NOW));
    }

    @Test
    void shouldUseNowAsAnchorWhenAbsent() {
        assertEquals(OptionalLong.of(NOW + 60_000), Schedules.computeNextRun(Schedule.every(60_000), NOW));
    }

    @Test
    void shouldNeverFireNonPositiveInterval() {
        assertTrue(Schedules.computeNextRun(new Schedule.Every(0, null), NOW).isEmpty());
        assertTrue(Schedules.computeNextRun(new Schedule.Every(-5, NOW), NOW).isEmpty());
    }

    @Test
    void shouldExhaustOneShotSchedule() {
        assertEquals(OptionalLong.of(NOW + 1), Schedules.computeNextRun(new Schedule.At(NOW + 1), NOW));
        assertTrue(Schedules.computeNextRun(new Schedule.At(NOW), NOW).isEmpty());
        assertTrue(Schedules.computeNextRun(new Schedule.At(NOW - 1), NOW).isEmpty());
    }

    @Test
    void shouldComputeNothingForDisabledJob() {
        ScheduledJob job = job(Schedule.every(60_000), false, NOW);
        assertTrue(Schedules.computeJobNextRun(job, NOW).isEmpty());
    }

    @Test
    void shouldAnchorIntervalJobToCreationTime() {
        ScheduledJob job = job(Schedule.every(60_000), true, NOW - 90_000);
        assertEquals(OptionalLong.of(NOW + 30_000), Schedules.computeJobNextRun(job, NOW));
    }

    @Test
    void shouldEvaluateCronInGivenTimezone() {
        long next = Schedules.computeNextRun(new Schedule.Cron("0 9 * * *", "UTC"), NOW).orElseThrow();
        assertEquals(Instant.parse("2024-01-02T09:00:00Z").toEpochMilli(), next);
    }

    @Test
    void shouldNotFireCronWithUnknownTimezone() {
        assertTrue(Schedules.computeNextRun(new Schedule.Cron("0 9 * * *", "Mars/Olympus"), NOW).isEmpty());
    }

    @Test
    void shouldRejectIntervalWhoseNextRunOverflows() {
        assertTrue(Schedules.computeNextRun(Schedule.every(Long.MAX_VALUE), NOW).isEmpty());
        assertTrue(Schedules.computeNextRun(new Schedule.Every(CronTimes.DAY, Long.MIN_VALUE), NOW).isEmpty());

        assertEquals("Interval is too large, got " + Long.MAX_VALUE,
                Schedules.validate(Schedule.every(Long.MAX_VALUE), NOW).error());
        assertTrue(Schedules.validate(Schedule.every(Long.MAX_VALUE - NOW), NOW).valid());
    }

    @Test
    void shouldValidateSchedules() {
        assertTrue(Schedules.validate(new Schedule.Cron("0 9 * * *", null), NOW).valid());
        assertTrue(Schedules.validate(new Schedule.At(NOW - 1_000), NOW).valid());
        assertTrue(Schedules.validate(Schedule.every(1), NOW).valid());

        assertEquals("Schedule is required", Schedules.validate(null, NOW).error());
        assertEquals("Interval must be positive, got 0", Schedules.validate(new Schedule.Every(0, null), NOW).error());
        assertEquals("Expected 5 or 6 fields, got 3", Schedules.validate(new Schedule.Cron("* * *", null), NOW).error());
        assertEquals("Unknown timezone: Nowhere/City", Schedules.validate(new Schedule.Cron("* * * * *", "Nowhere/City"), NOW).error());
        assertEquals("Expression never matches (within 2 years)",
                Schedules.validate(new Schedule.Cron("0 0 30 2 *", "UTC"), NOW).error());
    }

    @Test
    void shouldFormatSchedules() {
        assertEquals("Once at 2024-01-01T10:00:00Z", Schedules.format(new Schedule.At(NOW)));
        assertEquals("Every 2h", Schedules.format(Schedule.every(2 * CronTimes.HOUR)));
        assertEquals("Every 2m", Schedules.format(Schedule.every(90 * CronTimes.SECOND)));
        assertEquals("Every 3d", Schedules.format(Schedule.every(3 * CronTimes.DAY)));
        assertEquals("Every 30s", Schedules.format(Schedule.every(30 * CronTimes.SECOND)));
        assertEquals("Cron: 0 9 * * * (Europe/Berlin)", Schedules.format(new Schedule.Cron("0 9 * * *", "Europe/Berlin")));
        assertEquals("Cron: */5 * * * *", Schedules.format(Schedule.cron("*/5 * * * *")));
    }

    private static ScheduledJob job(Schedule schedule, boolean enabled, long createdAtMs) {
        return new ScheduledJob("job-1", "test", null, enabled, schedule, new Payload.SystemEvent("ping"),
                null, createdAtMs, createdAtMs, JobRunState.empty());
    }
}
