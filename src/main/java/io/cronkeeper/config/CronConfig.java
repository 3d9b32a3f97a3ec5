package io.cronkeeper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronkeeper.cron.CronEventListener;
import io.cronkeeper.cron.CronService;
import io.cronkeeper.cron.CronStore;
import io.cronkeeper.cron.JobExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Clock;

/**
 * Wires the store and the scheduler service. The service starts once the application is ready
 * and is closed with the context.
 */
@Configuration
@EnableConfigurationProperties(CronProperties.class)
public class CronConfig {

    private static final Logger log = LoggerFactory.getLogger(CronConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CronStore cronStore(CronProperties properties, ObjectMapper objectMapper, Clock clock) {
        log.info("Cron store: {}", properties.resolvedStorePath());
        return new CronStore(properties.resolvedStorePath(), objectMapper, clock);
    }

    /**
     * Forwards scheduler events to the Spring application event bus.
     */
    @Bean
    public CronEventListener cronEventListener(ApplicationEventPublisher publisher) {
        return publisher::publishEvent;
    }

    @Bean(destroyMethod = "close")
    public CronService cronService(CronStore cronStore, JobExecutor jobExecutor,
                                   CronEventListener cronEventListener, Clock clock,
                                   CronProperties properties) {
        return new CronService(cronStore, jobExecutor, cronEventListener, clock, properties.enabled());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startCronService(ApplicationReadyEvent event) {
        event.getApplicationContext().getBean(CronService.class).start();
    }
}
