package io.cronkeeper.cron;

/**
 * Common durations in milliseconds used by the scheduler.
 */
public final class CronTimes {

    public static final long SECOND = 1000L;
    public static final long MINUTE = 60 * SECOND;
    public static final long HOUR = 60 * MINUTE;
    public static final long DAY = 24 * HOUR;

    /** A run still marked as in flight after this long is treated as abandoned. */
    public static final long STUCK_RUN_MS = 2 * HOUR;

    private CronTimes() {
    }
}
