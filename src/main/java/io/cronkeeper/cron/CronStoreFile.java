package io.cronkeeper.cron;

import java.util.List;

/**
 * On-disk layout of the job store: {@code {"version": 1, "jobs": [...]}}.
 */
public record CronStoreFile(int version, List<ScheduledJob> jobs) {

    public static final int CURRENT_VERSION = 1;

    public static CronStoreFile empty() {
        return new CronStoreFile(CURRENT_VERSION, List.of());
    }
}
