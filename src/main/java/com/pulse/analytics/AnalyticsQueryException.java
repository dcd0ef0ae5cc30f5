package com.pulse.analytics;

/**
 * Non-retryable failure of a hosted analytics query: an API error the service
 * reported, or a transport error that never produced a response.
 *
 * Subclasses mark the recoverable cases that the client retries.
 */
public class AnalyticsQueryException extends RuntimeException {

    /**
     * Status used when no HTTP response was received.
     */
    public static final int NO_STATUS = -1;

    private final int status;

    public AnalyticsQueryException(String message, int status) {
        super(message);
        this.status = status;
    }

    public AnalyticsQueryException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * @return the HTTP status of the failed attempt, or {@link #NO_STATUS}
     */
    public int getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return false;
    }
}
