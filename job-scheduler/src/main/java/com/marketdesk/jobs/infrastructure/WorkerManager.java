package com.marketdesk.jobs.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketdesk.jobs.config.JobsProperties;
import com.marketdesk.jobs.service.JobMetricsService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Manages lifecycle of in-process task workers.
 * Disabled by default so that external workers own the queue.
 */
@Component
@Slf4j
public class WorkerManager {

    private final ExecutorService workerExecutorService;
    private final TaskQueue taskQueue;
    private final TaskStore taskStore;
    private final TaskHandlerRegistry handlerRegistry;
    private final ObjectMapper objectMapper;
    private final JobMetricsService metricsService;
    private final JobsProperties properties;

    private final List<TaskWorker> workers = new ArrayList<>();

    public WorkerManager(@Qualifier("workerExecutorService") ExecutorService workerExecutorService,
            TaskQueue taskQueue, TaskStore taskStore, TaskHandlerRegistry handlerRegistry,
            ObjectMapper objectMapper, JobMetricsService metricsService, JobsProperties properties) {
        this.workerExecutorService = workerExecutorService;
        this.taskQueue = taskQueue;
        this.taskStore = taskStore;
        this.handlerRegistry = handlerRegistry;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    @PostConstruct
    public void startWorkers() {
        JobsProperties.Worker settings = properties.getWorker();
        if (!settings.isEnabled()) {
            log.info("In-process task workers are disabled");
            return;
        }

        int threadCount = Math.max(1, settings.getThreadCount());
        log.info("Starting {} task workers for functions {}", threadCount, handlerRegistry.names());

        for (int i = 0; i < threadCount; i++) {
            String workerName = "TaskWorker-" + (i + 1);
            TaskWorker worker = new TaskWorker(
                    taskQueue,
                    taskStore,
                    handlerRegistry,
                    objectMapper,
                    metricsService,
                    properties.getQueue().getPopTimeout(),
                    properties.getQueue().getLeaseDuration(),
                    workerName);

            workers.add(worker);
            workerExecutorService.submit(worker);

            log.info("Started {}", workerName);
        }
    }

    @PreDestroy
    public void stopWorkers() {
        if (workers.isEmpty()) {
            return;
        }
        log.info("Stopping all workers...");

        workers.forEach(TaskWorker::stop);

        workerExecutorService.shutdown();

        try {
            if (!workerExecutorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Workers did not terminate gracefully, forcing shutdown");
                workerExecutorService.shutdownNow();
            } else {
                log.info("All workers stopped gracefully");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for workers to stop", e);
            workerExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public int getWorkerCount() {
        return workers.size();
    }
}
