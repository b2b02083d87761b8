package com.marketdesk.jobs.exception;

/**
 * Queue and task store operations, used to tag failures.
 */
public enum TaskOperation {
    ENQUEUE,
    POP,
    POLL,
    UPDATE,
    INSPECT,
    CLEAR,
    CANCEL,
    SERIALIZE
}
