package io.cronkeeper.cron;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a job run. {@link #NOT_FOUND} is only ever returned to callers, never stored on a job.
 */
public enum RunStatus {
    OK("ok"),
    ERROR("error"),
    SKIPPED("skipped"),
    CANCELLED("cancelled"),
    NOT_FOUND("not_found");

    private final String key;

    RunStatus(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
