package com.pulse.analytics;

import java.time.Duration;

/**
 * Connection and retry settings for the hosted analytics service.
 *
 * @param host        base URL, e.g. {@code https://us.i.posthog.com}
 * @param projectId   project whose data is queried; blank means not configured
 * @param apiKey      personal API key sent as a bearer token; blank means not configured
 * @param queryKind   dialect tag sent with every query
 * @param maxAttempts attempts per logical query, including the first
 * @param retryDelay  fixed pause before each retry
 */
public record AnalyticsServiceSettings(
        String host,
        String projectId,
        String apiKey,
        String queryKind,
        int maxAttempts,
        Duration retryDelay) {

    public static final String DEFAULT_HOST = "https://us.i.posthog.com";
    public static final String DEFAULT_QUERY_KIND = "HogQLQuery";
    public static final int DEFAULT_MAX_ATTEMPTS = 2;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(2);

    public AnalyticsServiceSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be zero or positive");
        }
    }

    public boolean isConfigured() {
        return projectId != null && !projectId.isBlank() && apiKey != null && !apiKey.isBlank();
    }

    public String queryEndpoint() {
        String base = host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
        return base + "/api/projects/" + projectId + "/query/";
    }
}
