package com.pulse.analytics;

/**
 * The hosted analytics service failed on its side (5xx or a
 * {@code server_error} body).
 */
public class ServerQueryException extends AnalyticsQueryException {

    public static final String DEFAULT_MESSAGE =
        "The analytics service is temporarily unavailable. Please try again.";

    public ServerQueryException(int status) {
        this(DEFAULT_MESSAGE, status);
    }

    public ServerQueryException(String message, int status) {
        super(message, status);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
