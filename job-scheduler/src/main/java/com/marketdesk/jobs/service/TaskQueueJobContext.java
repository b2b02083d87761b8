package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.JobContext;
import com.marketdesk.jobs.domain.Task;
import com.marketdesk.jobs.infrastructure.TaskQueue;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Job context backed by the shared work queue.
 */
@Slf4j
class TaskQueueJobContext implements JobContext {

    private final String jobName;
    private final TaskQueue taskQueue;
    private final TaskMonitor taskMonitor;
    private final List<String> enqueuedTaskIds = new ArrayList<>();

    TaskQueueJobContext(String jobName, TaskQueue taskQueue, TaskMonitor taskMonitor) {
        this.jobName = jobName;
        this.taskQueue = taskQueue;
        this.taskMonitor = taskMonitor;
    }

    @Override
    public String getJobName() {
        return jobName;
    }

    @Override
    public String enqueue(String function, Map<String, Object> args) {
        String taskId = taskQueue.enqueue(function, args);
        enqueuedTaskIds.add(taskId);
        return taskId;
    }

    @Override
    public Task awaitTask(String taskId, Duration timeout, Duration pollInterval) throws InterruptedException {
        return taskMonitor.await(taskId, timeout, pollInterval,
                (id, entry) -> log.info("[{}] {}: {}", id, entry.getLevel(), entry.getMessage()));
    }

    @Override
    public List<String> getEnqueuedTaskIds() {
        return Collections.unmodifiableList(enqueuedTaskIds);
    }
}
