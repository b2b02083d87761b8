package com.marketdesk.jobs.domain;

/**
 * Validity rule for tickers entering reconciliation.
 * Class-share and when-issued symbols (dotted or lowercase suffixes) are ignored.
 */
public final class TickerFilter {

    private TickerFilter() {
    }

    public static boolean isValid(String ticker) {
        if (ticker == null || ticker.isEmpty()) {
            return false;
        }
        if (ticker.indexOf('.') >= 0) {
            return false;
        }
        return ticker.chars().noneMatch(Character::isLowerCase);
    }
}
