package io.cronkeeper.cron;

/**
 * Performs a job's payload. Supplied by the host application.
 *
 * <p>May block. Any exception is recorded on the job as an {@code error} run.</p>
 */
@FunctionalInterface
public interface JobExecutor {

    RunResult execute(ScheduledJob job) throws Exception;
}
