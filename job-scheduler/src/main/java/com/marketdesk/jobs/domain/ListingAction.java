package com.marketdesk.jobs.domain;

/**
 * Actions the reconciler can take for one ticker on one day.
 */
public enum ListingAction {
    FALSE_DELIST,
    TICKER_CHANGE,
    FIGI_CHANGE,
    NEW_LISTING,
    DUPLICATE_LISTING,
    REMOVAL
}
