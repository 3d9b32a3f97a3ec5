package io.cronkeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CronKeeper: persistent background job scheduler for a chat-assistant runtime.
 * Jobs fire once, on a fixed interval, or on a cron expression.
 */
@SpringBootApplication
public class CronKeeperApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronKeeperApplication.class, args);
    }
}
