package io.cronkeeper.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A job as held by the store and written to disk.
 *
 * @param id             unique id, generated on creation
 * @param name           free text, not necessarily unique
 * @param description    optional description
 * @param enabled        disabled jobs are never scheduled
 * @param schedule       when the job fires
 * @param payload        what the executor receives
 * @param deleteAfterRun remove instead of disable after a one-shot run
 * @param createdAtMs    creation time
 * @param updatedAtMs    last modification time
 * @param state          run bookkeeping
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduledJob(
        String id,
        String name,
        String description,
        boolean enabled,
        Schedule schedule,
        Payload payload,
        Boolean deleteAfterRun,
        long createdAtMs,
        long updatedAtMs,
        JobRunState state
) {
    public ScheduledJob {
        if (state == null) {
            state = JobRunState.empty();
        }
    }

    public boolean deletesAfterRun() {
        return Boolean.TRUE.equals(deleteAfterRun);
    }

    public ScheduledJob withEnabled(boolean value) {
        return new ScheduledJob(id, name, description, value, schedule, payload, deleteAfterRun,
                createdAtMs, updatedAtMs, state);
    }

    public ScheduledJob withUpdatedAtMs(long value) {
        return new ScheduledJob(id, name, description, enabled, schedule, payload, deleteAfterRun,
                createdAtMs, value, state);
    }

    public ScheduledJob withState(JobRunState value) {
        return new ScheduledJob(id, name, description, enabled, schedule, payload, deleteAfterRun,
                createdAtMs, updatedAtMs, value);
    }
}
