package com.marketdesk.jobs.domain;

/**
 * Whether a boundary has fired in the current trading cycle.
 */
public enum BoundaryState {
    PENDING,
    FIRED
}
