package io.cronkeeper.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Next-run computation, validation and display for {@link Schedule}s. Pure functions, no I/O.
 */
public final class Schedules {

    private static final Logger log = LoggerFactory.getLogger(Schedules.class);

    private Schedules() {
    }

    /**
     * Computes the next due time strictly after {@code nowMs}, or empty if the schedule can never fire again.
     */
    public static OptionalLong computeNextRun(Schedule schedule, long nowMs) {
        if (schedule instanceof Schedule.At at) {
            return at.dueAtMs() > nowMs ? OptionalLong.of(at.dueAtMs()) : OptionalLong.empty();
        }
        if (schedule instanceof Schedule.Every every) {
            return nextInterval(every, nowMs);
        }
        if (schedule instanceof Schedule.Cron cron) {
            return resolveZone(cron.timezone())
                    .flatMap(zone -> CronExpression.parse(cron.expression(), zone))
                    .map(expression -> expression.nextAfter(nowMs))
                    .orElse(OptionalLong.empty());
        }
        return OptionalLong.empty();
    }

    /**
     * Next due time of a job: empty when disabled. An interval schedule without an anchor
     * is aligned to the job's creation time.
     */
    public static OptionalLong computeJobNextRun(ScheduledJob job, long nowMs) {
        if (!job.enabled()) {
            return OptionalLong.empty();
        }
        Schedule schedule = job.schedule();
        if (schedule instanceof Schedule.Every every && every.anchorMs() == null) {
            schedule = every.withAnchor(job.createdAtMs());
        }
        return computeNextRun(schedule, nowMs);
    }

    /**
     * Same as {@link #computeJobNextRun(ScheduledJob, long)} in the nullable form stored on {@link JobRunState}.
     */
    static Long nextRunOrNull(ScheduledJob job, long nowMs) {
        OptionalLong next = computeJobNextRun(job, nowMs);
        return next.isPresent() ? next.getAsLong() : null;
    }

    /**
     * Checks that a schedule is well formed and, for cron expressions, that it matches
     * within {@link CronExpression#SEARCH_HORIZON_MS} of {@code nowMs}.
     */
    public static ScheduleValidation validate(Schedule schedule, long nowMs) {
        if (schedule == null) {
            return ScheduleValidation.invalid("Schedule is required");
        }
        if (schedule instanceof Schedule.Every every) {
            if (every.intervalMs() <= 0) {
                return ScheduleValidation.invalid("Interval must be positive, got " + every.intervalMs());
            }
            if (nextInterval(every, nowMs).isEmpty()) {
                return ScheduleValidation.invalid("Interval is too large, got " + every.intervalMs());
            }
            return ScheduleValidation.ok();
        }
        if (schedule instanceof Schedule.Cron cron) {
            int fields = CronExpression.fieldCount(cron.expression());
            if (fields != 5 && fields != 6) {
                return ScheduleValidation.invalid("Expected 5 or 6 fields, got " + fields);
            }
            Optional<ZoneId> zone = resolveZone(cron.timezone());
            if (zone.isEmpty()) {
                return ScheduleValidation.invalid("Unknown timezone: " + cron.timezone());
            }
            OptionalLong next = CronExpression.parse(cron.expression(), zone.get())
                    .map(expression -> expression.nextAfter(nowMs))
                    .orElse(OptionalLong.empty());
            if (next.isEmpty()) {
                return ScheduleValidation.invalid("Expression never matches (within 2 years)");
            }
        }
        return ScheduleValidation.ok();
    }

    /**
     * Short human-readable rendering, for diagnostics and tool output.
     */
    public static String format(Schedule schedule) {
        if (schedule instanceof Schedule.At at) {
            return "Once at " + Instant.ofEpochMilli(at.dueAtMs());
        }
        if (schedule instanceof Schedule.Every every) {
            long ms = every.intervalMs();
            if (ms >= CronTimes.DAY) return "Every " + Math.round((double) ms / CronTimes.DAY) + "d";
            if (ms >= CronTimes.HOUR) return "Every " + Math.round((double) ms / CronTimes.HOUR) + "h";
            if (ms >= CronTimes.MINUTE) return "Every " + Math.round((double) ms / CronTimes.MINUTE) + "m";
            return "Every " + Math.round((double) ms / CronTimes.SECOND) + "s";
        }
        if (schedule instanceof Schedule.Cron cron) {
            String zone = cron.timezone() != null && !cron.timezone().isBlank() ? " (" + cron.timezone() + ")" : "";
            return "Cron: " + cron.expression() + zone;
        }
        return "Unknown schedule";
    }

    private static OptionalLong nextInterval(Schedule.Every every, long nowMs) {
        long interval = every.intervalMs();
        if (interval <= 0) {
            return OptionalLong.empty();
        }
        long anchor = every.anchorMs() != null ? every.anchorMs() : nowMs;
        if (nowMs < anchor) {
            return OptionalLong.of(anchor);
        }
        try {
            long steps = Math.floorDiv(Math.subtractExact(nowMs, anchor), interval) + 1;
            return OptionalLong.of(Math.addExact(anchor, Math.multiplyExact(steps, interval)));
        } catch (ArithmeticException e) {
            log.debug("Interval {} ms from anchor {} overflows, no next run", interval, anchor);
            return OptionalLong.empty();
        }
    }

    static Optional<ZoneId> resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return Optional.of(ZoneId.systemDefault());
        }
        try {
            return Optional.of(ZoneId.of(timezone.trim()));
        } catch (DateTimeException e) {
            log.debug("Unknown cron timezone '{}': {}", timezone, e.getMessage());
            return Optional.empty();
        }
    }
}
