package io.cronkeeper.cron;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * When a job fires. Stored with a {@code kind} discriminator: {@code at}, {@code every} or {@code cron}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Schedule.At.class, name = "at"),
        @JsonSubTypes.Type(value = Schedule.Every.class, name = "every"),
        @JsonSubTypes.Type(value = Schedule.Cron.class, name = "cron")
})
public sealed interface Schedule permits Schedule.At, Schedule.Every, Schedule.Cron {

    /**
     * Fires once at {@code dueAtMs}.
     *
     * @param dueAtMs epoch millis of the single run
     */
    record At(long dueAtMs) implements Schedule {
    }

    /**
     * Fires every {@code intervalMs}, aligned to {@code anchorMs}.
     *
     * @param intervalMs interval between runs, must be positive
     * @param anchorMs   alignment point; when null the job's creation time is used
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Every(long intervalMs, Long anchorMs) implements Schedule {

        public Every withAnchor(long anchor) {
            return new Every(intervalMs, anchor);
        }
    }

    /**
     * Fires according to a 5-field or 6-field cron expression.
     *
     * @param expression cron expression, e.g. {@code 0 9 * * *}
     * @param timezone   IANA zone id; null means the system default zone
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Cron(String expression, String timezone) implements Schedule {
    }

    static Schedule every(long intervalMs) {
        return new Every(intervalMs, null);
    }

    static Schedule cron(String expression) {
        return new Cron(expression, null);
    }
}
