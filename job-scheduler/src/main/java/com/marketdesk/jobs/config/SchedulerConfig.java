package com.marketdesk.jobs.config;

import com.marketdesk.jobs.exception.JobConfigurationException;
import com.marketdesk.jobs.infrastructure.BackgroundService;
import com.marketdesk.jobs.infrastructure.JobScheduler;
import com.marketdesk.jobs.infrastructure.JobStatusStore;
import com.marketdesk.jobs.infrastructure.TaskQueue;
import com.marketdesk.jobs.service.JobRegistry;
import com.marketdesk.jobs.service.JobRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the scheduler event loop and the exchange-zone clock.
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock(JobsProperties properties) {
        String zone = properties.getScheduler().getZone();
        try {
            return Clock.system(ZoneId.of(zone));
        } catch (DateTimeException e) {
            throw new JobConfigurationException("Unknown scheduler zone: " + zone, e);
        }
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "jobs.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public JobScheduler jobScheduler(JobRegistry jobRegistry, JobRunner jobRunner, TaskQueue taskQueue,
            JobStatusStore statusStore, ObjectProvider<BackgroundService> backgroundServices,
            @Qualifier("schedulerExecutorService") ScheduledExecutorService executor, Clock clock,
            JobsProperties properties) {
        return new JobScheduler(jobRegistry, jobRunner, taskQueue, statusStore,
                backgroundServices.orderedStream().toList(), executor, clock, properties.getScheduler());
    }
}
