package com.marketdesk.jobs.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for the securities table.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.marketdesk.jobs.repository")
@EnableJpaAuditing
@EnableTransactionManagement
public class JpaConfig {
}
