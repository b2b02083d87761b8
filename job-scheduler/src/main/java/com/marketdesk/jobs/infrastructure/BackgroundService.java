package com.marketdesk.jobs.infrastructure;

/**
 * A long-lived auxiliary connection (streaming feeds, alert loops) started with the scheduler.
 */
public interface BackgroundService {

    String getName();

    void start();

    void stop();
}
