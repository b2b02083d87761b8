package com.marketdesk.jobs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Settings for the scheduler, the work queue, the in-process workers,
 * securities reconciliation and the jobctl CLI.
 */
@Data
@ConfigurationProperties(prefix = "jobs")
public class JobsProperties {

    private final Scheduler scheduler = new Scheduler();
    private final Queue queue = new Queue();
    private final Worker worker = new Worker();
    private final Reconciliation reconciliation = new Reconciliation();
    private final Cli cli = new Cli();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private String zone = "America/New_York";
        private LocalTime openTime = LocalTime.of(4, 0);
        private LocalTime closeTime = LocalTime.of(20, 0);
        private Duration tickInterval = Duration.ofMinutes(1);
        private int queueStatusEveryTicks = 5;
    }

    @Data
    public static class Queue {
        private String key = "queue";
        private Duration popTimeout = Duration.ofSeconds(1);
        private Duration leaseDuration = Duration.ofMinutes(30);
    }

    @Data
    public static class Worker {
        private boolean enabled = false;
        private int threadCount = 2;
    }

    @Data
    public static class Reconciliation {
        private LocalDate coverageStart = LocalDate.of(2003, 9, 10);
        private boolean transactionalDays = true;
    }

    @Data
    public static class Cli {
        private Duration timeout = Duration.ofMinutes(5);
        private Duration pollInterval = Duration.ofSeconds(1);
    }
}
