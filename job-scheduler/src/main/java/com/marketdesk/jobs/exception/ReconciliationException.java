package com.marketdesk.jobs.exception;

import java.time.LocalDate;

/**
 * Per-record reconciliation failure with the context needed to trace it.
 */
public class ReconciliationException extends RuntimeException {

    private final ReconciliationStep step;
    private final String ticker;
    private final String figi;
    private final LocalDate date;

    public ReconciliationException(ReconciliationStep step, String ticker, String figi, LocalDate date,
            Throwable cause) {
        super(String.format("%s failed for ticker=%s figi=%s date=%s: %s",
                step, ticker, figi, date, cause == null ? "unknown" : cause.getMessage()), cause);
        this.step = step;
        this.ticker = ticker;
        this.figi = figi;
        this.date = date;
    }

    public ReconciliationStep getStep() {
        return step;
    }

    public String getTicker() {
        return ticker;
    }

    public String getFigi() {
        return figi;
    }

    public LocalDate getDate() {
        return date;
    }
}
