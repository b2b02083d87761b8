package com.marketdesk.jobs.domain;

/**
 * The two daily boundaries the scheduler fires jobs on.
 */
public enum MarketBoundary {
    OPEN,
    CLOSE
}
