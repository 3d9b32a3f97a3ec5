package io.cronkeeper.cron;

/**
 * Input for creating a job. {@code enabled} defaults to true.
 */
public record JobCreate(
        String name,
        String description,
        Boolean enabled,
        Schedule schedule,
        Payload payload,
        Boolean deleteAfterRun
) {
    public static JobCreate of(String name, Schedule schedule, Payload payload) {
        return new JobCreate(name, null, null, schedule, payload, null);
    }

    public static JobCreate oneShot(String name, long dueAtMs, Payload payload, boolean deleteAfterRun) {
        return new JobCreate(name, null, null, new Schedule.At(dueAtMs), payload, deleteAfterRun);
    }
}
