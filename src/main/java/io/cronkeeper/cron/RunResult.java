package io.cronkeeper.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one execution, as reported by a {@link JobExecutor} or returned from a manual run.
 *
 * @param status  run outcome
 * @param error   error message, set for {@code error}, {@code skipped} and {@code not_found}
 * @param summary short free-text summary produced by the executor
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResult(RunStatus status, String error, String summary) {

    public static RunResult ok(String summary) {
        return new RunResult(RunStatus.OK, null, summary);
    }

    public static RunResult error(String error) {
        return new RunResult(RunStatus.ERROR, error, null);
    }

    public static RunResult skipped(String reason) {
        return new RunResult(RunStatus.SKIPPED, reason, null);
    }

    public static RunResult cancelled(String summary) {
        return new RunResult(RunStatus.CANCELLED, "cancelled", summary);
    }

    public static RunResult notFound(String jobId) {
        return new RunResult(RunStatus.NOT_FOUND, "Job not found: " + jobId, null);
    }
}
