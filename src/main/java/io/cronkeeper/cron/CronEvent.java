package io.cronkeeper.cron;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle event emitted by {@link CronService}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronEvent(
        String jobId,
        Action action,
        long timestamp,
        Long runAtMs,
        Long durationMs,
        RunStatus status,
        String error,
        String summary,
        Long nextRunAtMs
) {
    public enum Action {
        ADDED, UPDATED, REMOVED, STARTED, FINISHED;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }
    }

    static CronEvent of(String jobId, Action action, long timestamp, Long nextRunAtMs) {
        return new CronEvent(jobId, action, timestamp, null, null, null, null, null, nextRunAtMs);
    }

    static CronEvent started(String jobId, long timestamp) {
        return new CronEvent(jobId, Action.STARTED, timestamp, timestamp, null, null, null, null, null);
    }

    static CronEvent finished(String jobId, long timestamp, long runAtMs, long durationMs,
                              RunResult result, Long nextRunAtMs) {
        return new CronEvent(jobId, Action.FINISHED, timestamp, runAtMs, durationMs,
                result.status(), result.error(), result.summary(), nextRunAtMs);
    }
}
