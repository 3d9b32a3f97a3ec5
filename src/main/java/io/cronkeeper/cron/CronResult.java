package io.cronkeeper.cron;

/**
 * Either a value or a {@link CronError}. Used instead of exceptions across the scheduler API.
 */
public record CronResult<T>(T value, CronError error) {

    public static <T> CronResult<T> ok(T value) {
        return new CronResult<>(value, null);
    }

    public static <T> CronResult<T> failure(CronError.Code code, String message) {
        return new CronResult<>(null, new CronError(code, message));
    }

    public static <T> CronResult<T> failure(CronError error) {
        return new CronResult<>(null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
