package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.Task;
import com.marketdesk.jobs.domain.TaskLogEntry;
import com.marketdesk.jobs.infrastructure.TaskQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Polls task records until they reach a terminal status, reporting log lines as they appear.
 */
@Service
@RequiredArgsConstructor
public class TaskMonitor {

    private final TaskQueue taskQueue;

    /**
     * Follow one task.
     *
     * @return the last observed record, terminal unless the timeout elapsed
     * @throws com.marketdesk.jobs.exception.TaskNotFoundException if the task does not exist
     */
    public Task await(String taskId, Duration timeout, Duration pollInterval,
            BiConsumer<String, TaskLogEntry> onNewLog) throws InterruptedException {
        return awaitAll(List.of(taskId), timeout, pollInterval, onNewLog).get(taskId);
    }

    /**
     * Follow several tasks until all are terminal or the timeout elapses.
     * Tasks are never cancelled on timeout.
     *
     * @return the last observed record of every task, in the given order
     */
    public Map<String, Task> awaitAll(Collection<String> taskIds, Duration timeout, Duration pollInterval,
            BiConsumer<String, TaskLogEntry> onNewLog) throws InterruptedException {
        Map<String, Task> latest = new LinkedHashMap<>();
        Map<String, Integer> logsSeen = new HashMap<>();
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            boolean allTerminal = true;
            for (String taskId : taskIds) {
                Task previous = latest.get(taskId);
                if (previous != null && previous.isTerminal()) {
                    continue;
                }
                Task task = taskQueue.poll(taskId);
                latest.put(taskId, task);
                emitNewLogs(task, logsSeen, onNewLog);
                allTerminal &= task.isTerminal();
            }

            long remaining = deadline - System.nanoTime();
            if (allTerminal || remaining <= 0) {
                return latest;
            }
            Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
        }
    }

    private void emitNewLogs(Task task, Map<String, Integer> logsSeen, BiConsumer<String, TaskLogEntry> onNewLog) {
        List<TaskLogEntry> logs = task.getLogs();
        if (logs == null || onNewLog == null) {
            return;
        }
        int seen = logsSeen.getOrDefault(task.getId(), 0);
        for (int i = seen; i < logs.size(); i++) {
            onNewLog.accept(task.getId(), logs.get(i));
        }
        logsSeen.put(task.getId(), Math.max(seen, logs.size()));
    }
}
