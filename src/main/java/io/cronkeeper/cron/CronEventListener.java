package io.cronkeeper.cron;

/**
 * Receives scheduler lifecycle events. Exceptions thrown here are logged and ignored.
 */
@FunctionalInterface
public interface CronEventListener {

    CronEventListener NOOP = event -> { };

    void onEvent(CronEvent event);
}
