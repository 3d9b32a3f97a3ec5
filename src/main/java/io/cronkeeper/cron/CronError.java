package io.cronkeeper.cron;

/**
 * Typed failure returned by the scheduler API for bad input.
 */
public record CronError(Code code, String message) {

    public enum Code {
        NOT_FOUND,
        INVALID_INPUT,
        INVALID_SCHEDULE,
        PAYLOAD_MISMATCH
    }

    public static CronError notFound(String jobId) {
        return new CronError(Code.NOT_FOUND, "Job not found: " + jobId);
    }
}
