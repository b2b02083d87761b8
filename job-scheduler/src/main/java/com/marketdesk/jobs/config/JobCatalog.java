package com.marketdesk.jobs.config;

import com.marketdesk.jobs.domain.JobDefinition;
import com.marketdesk.jobs.domain.Task;
import com.marketdesk.jobs.domain.TaskStatus;
import com.marketdesk.jobs.infrastructure.TaskQueue;
import com.marketdesk.jobs.service.CikBackfillService;
import com.marketdesk.jobs.service.JobRegistry;
import com.marketdesk.jobs.service.SecuritiesReconciler;
import com.marketdesk.jobs.service.SecurityDetailsService;
import com.marketdesk.jobs.service.StaleTaskReaper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Map;

/**
 * The daily jobs run by the scheduler and available to jobctl.
 */
@Configuration
@Slf4j
public class JobCatalog {

    public static final String CLEAR_WORKER_QUEUE = "ClearWorkerQueue";
    public static final String UPDATE_MARKET_METRICS = "UpdateMarketMetrics";
    public static final String UPDATE_SECTORS = "UpdateSectors";
    public static final String SIMPLE_UPDATE_SECURITIES = "SimpleUpdateSecurities";
    public static final String UPDATE_SECURITIES = "UpdateSecurities";
    public static final String UPDATE_SECURITY_DETAILS = "UpdateSecurityDetails";
    public static final String UPDATE_SECURITY_CIK = "UpdateSecurityCik";
    public static final String REAP_STALE_TASKS = "ReapStaleTasks";

    static final Duration SECTORS_POLL_INTERVAL = Duration.ofSeconds(10);
    static final Duration SECTORS_TIMEOUT = SECTORS_POLL_INTERVAL.multipliedBy(30);

    @Bean
    public JobRegistry jobRegistry(TaskQueue taskQueue, SecuritiesReconciler securitiesReconciler,
            CikBackfillService cikBackfillService, SecurityDetailsService securityDetailsService,
            StaleTaskReaper staleTaskReaper) {
        JobRegistry registry = new JobRegistry();

        // First job of the OPEN batch, ahead of every job that enqueues
        registry.register(JobDefinition.builder()
                .name(CLEAR_WORKER_QUEUE)
                .at(LocalTime.of(4, 0))
                .skipOnWeekends(true)
                .runOnInit(true)
                .function(context -> log.info("Cancelled {} stale queued tasks", taskQueue.clear()))
                .build());

        registry.register(JobDefinition.builder()
                .name(UPDATE_MARKET_METRICS)
                .at(LocalTime.of(8, 0))
                .at(LocalTime.of(20, 30))
                .skipOnWeekends(true)
                .function(context -> context.enqueue("update_active", Map.of()))
                .build());

        registry.register(JobDefinition.builder()
                .name(UPDATE_SECTORS)
                .at(LocalTime.of(20, 15))
                .skipOnWeekends(true)
                .function(context -> {
                    String taskId = context.enqueue("update_sectors", Map.of());
                    Task task = context.awaitTask(taskId, SECTORS_TIMEOUT, SECTORS_POLL_INTERVAL);
                    if (!task.isTerminal()) {
                        throw new IllegalStateException("update_sectors task " + taskId + " did not finish within "
                                + SECTORS_TIMEOUT.toMinutes() + " minutes");
                    }
                    if (task.getStatus() != TaskStatus.COMPLETED) {
                        throw new IllegalStateException("update_sectors task " + taskId + " "
                                + task.getStatus().getValue() + ": " + task.getError());
                    }
                })
                .build());

        registry.register(JobDefinition.builder()
                .name(SIMPLE_UPDATE_SECURITIES)
                .at(LocalTime.of(20, 45))
                .skipOnWeekends(true)
                .runOnInit(true)
                .function(context -> log.info("Daily securities update: {}", securitiesReconciler.reconcileToday()))
                .build());

        registry.register(JobDefinition.builder()
                .name(UPDATE_SECURITIES)
                .at(LocalTime.of(21, 0))
                .skipOnWeekends(true)
                .function(context -> log.info("Securities history update: {}",
                        securitiesReconciler.reconcileSinceLatestListing()))
                .build());

        // After the history update so new listings get their branding the same night
        registry.register(JobDefinition.builder()
                .name(UPDATE_SECURITY_DETAILS)
                .at(LocalTime.of(21, 15))
                .skipOnWeekends(true)
                .runOnInit(true)
                .function(context -> securityDetailsService.updateActiveSecurities())
                .build());

        registry.register(JobDefinition.builder()
                .name(UPDATE_SECURITY_CIK)
                .at(LocalTime.of(21, 30))
                .skipOnWeekends(true)
                .function(context -> cikBackfillService.backfill())
                .build());

        registry.register(JobDefinition.builder()
                .name(REAP_STALE_TASKS)
                .at(LocalTime.of(4, 30))
                .at(LocalTime.of(20, 5))
                .runOnInit(true)
                .function(context -> staleTaskReaper.reap())
                .build());

        return registry;
    }
}
