package com.marketdesk.jobs;

import com.marketdesk.jobs.cli.JobControlCli;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point for jobctl. Boots the shared context without the web server,
 * the scheduler loop or the workers, runs one command and exits with its code.
 */
public class JobCtlApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = new SpringApplicationBuilder(MarketJobsApplication.class)
                .web(WebApplicationType.NONE)
                .profiles("cli")
                .properties("jobs.scheduler.enabled=false", "jobs.worker.enabled=false")
                .logStartupInfo(false)
                .run();

        int code = context.getBean(JobControlCli.class).execute(args);
        System.exit(SpringApplication.exit(context, () -> code));
    }
}
