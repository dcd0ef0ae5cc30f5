package com.pulse.analytics;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Client for the hosted event-analytics query service.
 *
 * All calls share one concurrency limiter and retry throttled and server
 * errors a bounded number of times. Failures surface as
 * {@link ThrottledQueryException}, {@link ServerQueryException} or a plain
 * {@link AnalyticsQueryException}; a call is all-or-nothing.
 */
public interface AnalyticsQueryClient {

    /**
     * Runs a query against the configured project.
     *
     * @param queryText final, rendered query text
     * @return result rows, or an empty list if the service is not configured
     */
    Mono<List<List<Object>>> executeQuery(String queryText);

    /**
     * Like {@link #executeQuery(String)} but returns the whole response, and
     * logs service warnings and truncation under {@code label}.
     */
    Mono<AnalyticsQueryResponse> executeQueryDetailed(String queryText, String label);

    /**
     * Runs a query against an explicit endpoint with explicit headers.
     *
     * @param endpoint    full URL of the query endpoint
     * @param queryText   final, rendered query text
     * @param authHeaders headers to send, must carry {@code Authorization}
     * @return result rows, or an empty list without a call when the endpoint
     *         is blank or no authorization header is given
     */
    Mono<List<List<Object>>> executeQuery(String endpoint, String queryText, Map<String, String> authHeaders);

    /**
     * @return false when credentials or the project are missing
     */
    boolean isConfigured();
}
