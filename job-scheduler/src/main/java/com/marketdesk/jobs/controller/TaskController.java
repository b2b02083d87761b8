package com.marketdesk.jobs.controller;

import com.marketdesk.jobs.controller.dto.EnqueueTaskRequest;
import com.marketdesk.jobs.controller.dto.EnqueueTaskResponse;
import com.marketdesk.jobs.controller.dto.QueueStatusResponse;
import com.marketdesk.jobs.domain.Task;
import com.marketdesk.jobs.domain.TaskStatus;
import com.marketdesk.jobs.infrastructure.TaskQueue;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;

/**
 * REST controller for enqueueing and polling tasks.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class TaskController {

    private static final int MAX_PENDING = 100;

    private final TaskQueue taskQueue;

    /**
     * Enqueue a task. Returns once the task is on the queue; it runs asynchronously.
     *
     * @param request function name and arguments
     * @return the new task ID
     */
    @PostMapping("/tasks")
    public ResponseEntity<EnqueueTaskResponse> enqueueTask(@Valid @RequestBody EnqueueTaskRequest request) {
        log.info("POST /tasks - Function: {}", request.getFunction());

        String taskId = taskQueue.enqueue(request.getFunction(),
                request.getArgs() == null ? new LinkedHashMap<>() : request.getArgs());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(EnqueueTaskResponse.builder()
                .taskId(taskId)
                .function(request.getFunction())
                .status(TaskStatus.QUEUED)
                .build());
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<Task> getTask(@PathVariable String taskId) {
        return ResponseEntity.ok(taskQueue.poll(taskId));
    }

    /**
     * Queue depth and the oldest pending envelopes.
     */
    @GetMapping("/queue")
    public ResponseEntity<QueueStatusResponse> getQueue(@RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > MAX_PENDING) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PENDING);
        }
        return ResponseEntity.ok(QueueStatusResponse.builder()
                .depth(taskQueue.depth())
                .pending(taskQueue.pending(limit))
                .build());
    }
}
