package io.cronkeeper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Scheduler configuration.
 *
 * <p>Binds to {@code cron.*} in application.yml:</p>
 * <pre>
 * cron:
 *   enabled: ${CRON_ENABLED:true}
 *   store-path: ${CRON_STORE_PATH:${user.home}/.cronkeeper/cron/jobs.json}
 * </pre>
 *
 * @param enabled   when false the API still works but the timer is never armed
 * @param storePath JSON file holding the jobs
 */
@ConfigurationProperties(prefix = "cron")
public record CronProperties(Boolean enabled, String storePath) {

    public CronProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (storePath == null || storePath.isBlank()) {
            storePath = defaultStorePath().toString();
        }
    }

    public Path resolvedStorePath() {
        String path = storePath.startsWith("~/")
                ? System.getProperty("user.home") + storePath.substring(1)
                : storePath;
        return Path.of(path).toAbsolutePath().normalize();
    }

    static Path defaultStorePath() {
        return Path.of(System.getProperty("user.home"), ".cronkeeper", "cron", "jobs.json");
    }
}
