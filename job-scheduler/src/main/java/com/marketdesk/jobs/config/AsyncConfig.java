package com.marketdesk.jobs.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Thread pools for queue workers and the scheduler event loop.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "workerExecutorService", destroyMethod = "shutdownNow")
    public ExecutorService workerExecutorService(JobsProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorker().getThreadCount()),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("TaskWorker-" + thread.getId());
                    thread.setDaemon(false);
                    return thread;
                });
    }

    /**
     * Single thread: jobs fired by a boundary run one after another on the loop thread.
     */
    @Bean(name = "schedulerExecutorService", destroyMethod = "shutdownNow")
    public ScheduledExecutorService schedulerExecutorService() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r);
            thread.setName("JobScheduler");
            thread.setDaemon(false);
            return thread;
        });
    }
}
