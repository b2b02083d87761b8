package com.marketdesk.jobs.exception;

/**
 * Steps of one reconciliation day, used to tag per-record failures.
 */
public enum ReconciliationStep {
    FIGI_CHANGE,
    CLASSIFY,
    APPLY_ADDITION,
    REMOVAL,
    CIK_BACKFILL
}
