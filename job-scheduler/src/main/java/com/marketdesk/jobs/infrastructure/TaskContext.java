package com.marketdesk.jobs.infrastructure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Lets a running handler append log lines to its task record.
 * Every append renews the task's lease.
 */
@RequiredArgsConstructor
@Slf4j
public class TaskContext {

    private final String taskId;
    private final TaskStore taskStore;
    private final Duration leaseDuration;

    public String getTaskId() {
        return taskId;
    }

    public void info(String message) {
        append("info", message);
    }

    public void warn(String message) {
        append("warn", message);
    }

    public void error(String message) {
        append("error", message);
    }

    /**
     * Renew the lease without adding a log line, for handlers that work silently for long stretches.
     */
    public void heartbeat() {
        if (!taskStore.renewLease(taskId, leaseDuration)) {
            log.warn("Task {} is no longer running; lease not renewed", taskId);
        }
    }

    private void append(String level, String message) {
        log.debug("[{}] {}", level, message);
        taskStore.appendLog(taskId, level, message, leaseDuration);
    }
}
