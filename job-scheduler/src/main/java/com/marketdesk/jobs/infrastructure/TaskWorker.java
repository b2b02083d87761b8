package com.marketdesk.jobs.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketdesk.jobs.domain.QueueEnvelope;
import com.marketdesk.jobs.domain.Task;
import com.marketdesk.jobs.service.JobMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Background worker that pops task envelopes and runs the matching handler.
 * Each worker runs in its own thread and continuously polls the queue.
 */
@Slf4j
public class TaskWorker implements Runnable {

    private final TaskQueue taskQueue;
    private final TaskStore taskStore;
    private final TaskHandlerRegistry handlerRegistry;
    private final ObjectMapper objectMapper;
    private final JobMetricsService metricsService;
    private final Duration popTimeout;
    private final Duration leaseDuration;
    private final String workerName;

    private volatile boolean running = true;

    public TaskWorker(TaskQueue taskQueue, TaskStore taskStore, TaskHandlerRegistry handlerRegistry,
            ObjectMapper objectMapper, JobMetricsService metricsService, Duration popTimeout,
            Duration leaseDuration, String workerName) {
        this.taskQueue = taskQueue;
        this.taskStore = taskStore;
        this.handlerRegistry = handlerRegistry;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.popTimeout = popTimeout;
        this.leaseDuration = leaseDuration;
        this.workerName = workerName;
    }

    @Override
    public void run() {
        log.info("{} started and polling queue", workerName);

        while (running) {
            try {
                Optional<QueueEnvelope> envelope = taskQueue.pop(popTimeout);
                envelope.ifPresent(this::processEnvelope);
            } catch (Exception e) {
                log.error("{} encountered error while polling queue: {}",
                        workerName, e.getMessage(), e);

                // Brief pause before retrying to avoid tight loop on persistent errors
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("{} interrupted during error recovery", workerName);
                    break;
                }
            }
        }

        log.info("{} stopped", workerName);
    }

    /**
     * Process a single envelope popped from the queue.
     */
    void processEnvelope(QueueEnvelope envelope) {
        String taskId = envelope.getId();
        if (taskId == null) {
            log.warn("{} - Received envelope without task ID", workerName);
            return;
        }

        MDC.put("taskId", taskId);
        MDC.put("worker", workerName);

        try {
            Optional<Task> claimed = taskStore.markRunning(taskId, workerName, leaseDuration);
            if (claimed.isEmpty()) {
                Optional<Task> existing = taskStore.find(taskId);
                if (existing.isEmpty()) {
                    log.warn("Task record not found. Skipping envelope for {}", envelope.getFunc());
                } else {
                    log.info("Task is {}. Skipping.", existing.get().getStatus().getValue());
                }
                return;
            }

            Task task = claimed.get();
            Optional<TaskHandler> handler = handlerRegistry.find(task.getFunction());
            if (handler.isEmpty()) {
                log.warn("No handler for function {}", task.getFunction());
                taskStore.fail(taskId, "unknown function: " + task.getFunction());
                metricsService.recordTaskFailed();
                return;
            }

            Map<String, Object> args = task.getArgs() != null ? task.getArgs() : envelope.getArgs();
            log.info("Processing - Function: {}, Args: {}", task.getFunction(), args);

            long startTime = System.currentTimeMillis();
            Object result = handler.get().execute(args, new TaskContext(taskId, taskStore, leaseDuration));
            JsonNode resultNode = result == null ? null : objectMapper.valueToTree(result);
            taskStore.complete(taskId, resultNode);
            metricsService.recordTaskCompleted();

            log.info("Task completed in {}ms", System.currentTimeMillis() - startTime);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Processing interrupted");
            taskStore.fail(taskId, "interrupted");
            metricsService.recordTaskFailed();
            running = false;
        } catch (Exception e) {
            log.error("Failed to process task: {}", e.getMessage(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            taskStore.fail(taskId, error);
            metricsService.recordTaskFailed();
        } finally {
            MDC.remove("taskId");
            MDC.remove("worker");
        }
    }

    /**
     * Gracefully stop the worker.
     */
    public void stop() {
        log.info("Stopping {}", workerName);
        running = false;
    }

    public boolean isRunning() {
        return running;
    }
}
