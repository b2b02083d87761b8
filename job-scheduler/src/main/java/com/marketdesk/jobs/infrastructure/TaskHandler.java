package com.marketdesk.jobs.infrastructure;

import java.util.Map;

/**
 * Executes one kind of queued task, identified by its function name.
 */
public interface TaskHandler {

    String name();

    /**
     * Run the task.
     *
     * @return a result object serialized into the task record, or null
     */
    Object execute(Map<String, Object> args, TaskContext context) throws Exception;
}
