package io.cronkeeper.cron;

/**
 * Diagnostic snapshot of the scheduler.
 *
 * @param enabled      whether the timer may be armed at all
 * @param started      whether {@link CronService#start()} has been called
 * @param storePath    backing file
 * @param jobs         number of jobs in the store
 * @param nextWakeAtMs due time the timer is armed for, null when disarmed
 */
public record CronStatus(boolean enabled, boolean started, String storePath, int jobs, Long nextWakeAtMs) {
}
