package io.cronkeeper.cron;

/**
 * Partial update of a job. Null components are left unchanged.
 *
 * <p>A payload of the same kind as the job's current payload is merged field by field;
 * a payload of another kind replaces the current one and must then be complete.</p>
 */
public record JobPatch(
        String name,
        String description,
        Boolean enabled,
        Schedule schedule,
        Payload payload,
        Boolean deleteAfterRun
) {
    public static JobPatch ofName(String name) {
        return new JobPatch(name, null, null, null, null, null);
    }

    public static JobPatch ofEnabled(boolean enabled) {
        return new JobPatch(null, null, enabled, null, null, null);
    }

    public static JobPatch ofSchedule(Schedule schedule) {
        return new JobPatch(null, null, null, schedule, null, null);
    }

    public static JobPatch ofPayload(Payload payload) {
        return new JobPatch(null, null, null, null, payload, null);
    }

    public boolean isEmpty() {
        return name == null && description == null && enabled == null
                && schedule == null && payload == null && deleteAfterRun == null;
    }
}
