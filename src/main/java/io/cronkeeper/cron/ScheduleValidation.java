package io.cronkeeper.cron;

/**
 * Result of {@link Schedules#validate(Schedule, long)}.
 */
public record ScheduleValidation(boolean valid, String error) {

    static ScheduleValidation ok() {
        return new ScheduleValidation(true, null);
    }

    static ScheduleValidation invalid(String error) {
        return new ScheduleValidation(false, error);
    }
}
