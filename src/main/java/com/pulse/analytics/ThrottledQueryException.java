package com.pulse.analytics;

/**
 * The hosted analytics service throttled the query (HTTP 429 or a
 * {@code throttled} error body).
 */
public class ThrottledQueryException extends AnalyticsQueryException {

    public static final String DEFAULT_MESSAGE =
        "The analytics service is temporarily busy. Please try again in a moment.";

    public ThrottledQueryException(int status) {
        this(DEFAULT_MESSAGE, status);
    }

    public ThrottledQueryException(String message, int status) {
        super(message, status);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
