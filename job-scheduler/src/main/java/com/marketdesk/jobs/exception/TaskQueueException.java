package com.marketdesk.jobs.exception;

/**
 * Raised when the queue or task store cannot complete an operation.
 */
public class TaskQueueException extends RuntimeException {

    private final TaskOperation operation;
    private final String taskId;

    public TaskQueueException(TaskOperation operation, String taskId, String message, Throwable cause) {
        super(format(operation, taskId, message), cause);
        this.operation = operation;
        this.taskId = taskId;
    }

    public TaskQueueException(TaskOperation operation, String message, Throwable cause) {
        this(operation, null, message, cause);
    }

    public TaskOperation getOperation() {
        return operation;
    }

    public String getTaskId() {
        return taskId;
    }

    private static String format(TaskOperation operation, String taskId, String message) {
        return taskId == null
                ? operation + " failed: " + message
                : operation + " failed for task " + taskId + ": " + message;
    }
}
