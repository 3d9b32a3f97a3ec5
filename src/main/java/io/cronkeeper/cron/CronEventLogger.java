package io.cronkeeper.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs scheduler events published on the application event bus.
 */
@Component
public class CronEventLogger {

    private static final Logger log = LoggerFactory.getLogger(CronEventLogger.class);

    @EventListener
    public void onCronEvent(CronEvent event) {
        if (event.action() == CronEvent.Action.FINISHED && event.status() == RunStatus.ERROR) {
            log.warn("Cron job {} failed after {} ms: {}", event.jobId(), event.durationMs(), event.error());
            return;
        }
        if (event.action() == CronEvent.Action.FINISHED) {
            log.debug("Cron job {} finished: {} (next run {})", event.jobId(), event.status().key(), event.nextRunAtMs());
            return;
        }
        log.debug("Cron job {} {}", event.jobId(), event.action().key());
    }
}
