package com.marketdesk.jobs.exception;

/**
 * Raised when the market-data provider cannot serve a request.
 */
public class MarketDataException extends RuntimeException {

    private final String endpoint;

    public MarketDataException(String endpoint, String message, Throwable cause) {
        super(endpoint + ": " + message, cause);
        this.endpoint = endpoint;
    }

    public MarketDataException(String endpoint, String message) {
        this(endpoint, message, null);
    }

    public String getEndpoint() {
        return endpoint;
    }
}
