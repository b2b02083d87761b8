package com.marketdesk.jobs;

import com.marketdesk.jobs.config.JobsProperties;
import com.marketdesk.jobs.config.MarketDataProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for the market jobs service.
 * Runs the daily scheduler, the optional in-process task workers and the HTTP surface.
 */
@SpringBootApplication
@EnableConfigurationProperties({JobsProperties.class, MarketDataProperties.class})
public class MarketJobsApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketJobsApplication.class, args);
    }

}
