package io.cronkeeper.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Run bookkeeping of a job. {@code runningAtMs} is set only while an execution is in flight
 * and is the guard against running the same job twice at once.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRunState(
        Long nextRunAtMs,
        Long lastRunAtMs,
        RunStatus lastStatus,
        Long lastDurationMs,
        String lastError,
        Long runningAtMs,
        int runCount
) {
    private static final JobRunState EMPTY = new JobRunState(null, null, null, null, null, null, 0);

    public static JobRunState empty() {
        return EMPTY;
    }

    public JobRunState withNextRunAtMs(Long next) {
        return new JobRunState(next, lastRunAtMs, lastStatus, lastDurationMs, lastError, runningAtMs, runCount);
    }

    public JobRunState withRunningAtMs(Long running) {
        return new JobRunState(nextRunAtMs, lastRunAtMs, lastStatus, lastDurationMs, lastError, running, runCount);
    }

    /**
     * Records a finished run: clears the in-flight marker and bumps the run counter.
     */
    public JobRunState withCompletedRun(long startedAtMs, long durationMs, RunResult result) {
        return new JobRunState(nextRunAtMs, startedAtMs, result.status(), durationMs, result.error(),
                null, runCount + 1);
    }
}
