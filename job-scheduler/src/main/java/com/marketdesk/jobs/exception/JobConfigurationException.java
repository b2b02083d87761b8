package com.marketdesk.jobs.exception;

/**
 * Raised when a job definition or scheduler setting is invalid.
 */
public class JobConfigurationException extends RuntimeException {

    public JobConfigurationException(String message) {
        super(message);
    }

    public JobConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
