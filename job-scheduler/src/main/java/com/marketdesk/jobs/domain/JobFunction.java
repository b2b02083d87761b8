package com.marketdesk.jobs.domain;

/**
 * Body of a scheduled job.
 */
@FunctionalInterface
public interface JobFunction {

    void run(JobContext context) throws Exception;
}
