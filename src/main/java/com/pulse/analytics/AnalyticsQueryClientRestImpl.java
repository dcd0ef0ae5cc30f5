package com.pulse.analytics;

import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.List;
import java.util.Map;

/**
 * REST implementation of {@link AnalyticsQueryClient}.
 *
 * One logical query:
 * 1. Takes a slot from the shared {@link ConcurrencyLimiter} and keeps it
 *    until the query, retries included, has finished
 * 2. POSTs the query; a 2xx body is parsed and its {@code results} returned
 * 3. A failed response is classified by {@link QueryErrorClassifier};
 *    throttled and server errors are retried after a fixed delay while
 *    attempts remain, everything else fails immediately
 *
 * Transport errors (no response at all) are not retried.
 */
public class AnalyticsQueryClientRestImpl implements AnalyticsQueryClient {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsQueryClientRestImpl.class);

    private final WebClient webClient;
    private final ConcurrencyLimiter limiter;
    private final QueryErrorClassifier classifier;
    private final AnalyticsClientMetrics metrics;
    private final AnalyticsServiceSettings settings;

    public AnalyticsQueryClientRestImpl(
            WebClient webClient,
            ConcurrencyLimiter limiter,
            QueryErrorClassifier classifier,
            AnalyticsClientMetrics metrics,
            AnalyticsServiceSettings settings) {
        this.webClient = webClient;
        this.limiter = limiter;
        this.classifier = classifier;
        this.metrics = metrics;
        this.settings = settings;

        if (settings.isConfigured()) {
            log.info("Analytics query client initialized (endpoint={}, maxAttempts={}, retryDelay={})",
                settings.queryEndpoint(), settings.maxAttempts(), settings.retryDelay());
        } else {
            log.warn("Analytics service credentials not configured; analytics queries will return no rows");
        }
    }

    @Override
    public boolean isConfigured() {
        return settings.isConfigured();
    }

    @Override
    public Mono<List<List<Object>>> executeQuery(String queryText) {
        return executeQueryDetailed(queryText, null).map(AnalyticsQueryResponse::getResults);
    }

    @Override
    public Mono<AnalyticsQueryResponse> executeQueryDetailed(String queryText, String label) {
        if (!settings.isConfigured()) {
            log.warn("Analytics service credentials not configured, skipping query");
            metrics.recordUnconfigured();
            return Mono.just(AnalyticsQueryResponse.empty());
        }

        Map<String, String> headers = Map.of(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey());
        return execute(settings.queryEndpoint(), queryText, headers)
            .doOnNext(response -> logResponseNotes(response, label));
    }

    @Override
    public Mono<List<List<Object>>> executeQuery(String endpoint, String queryText, Map<String, String> authHeaders) {
        if (endpoint == null || endpoint.isBlank() || !hasAuthorization(authHeaders)) {
            log.warn("Analytics endpoint or authorization missing, skipping query");
            metrics.recordUnconfigured();
            return Mono.just(List.of());
        }
        return execute(endpoint, queryText, authHeaders).map(AnalyticsQueryResponse::getResults);
    }

    private static boolean hasAuthorization(Map<String, String> headers) {
        if (headers == null) {
            return false;
        }
        return headers.entrySet().stream()
            .anyMatch(h -> HttpHeaders.AUTHORIZATION.equalsIgnoreCase(h.getKey())
                && h.getValue() != null && !h.getValue().isBlank());
    }

    private Mono<AnalyticsQueryResponse> execute(String endpoint, String queryText, Map<String, String> headers) {
        AnalyticsQueryRequest request = new AnalyticsQueryRequest(settings.queryKind(), queryText);

        return limiter.withPermit(() -> {
            Timer.Sample sample = metrics.startTimer();
            return attempt(endpoint, request, headers)
                .retryWhen(retryPolicy())
                .doOnError(AnalyticsQueryException.class, metrics::recordFailure)
                .doFinally(signal -> metrics.recordLatency(sample));
        });
    }

    /**
     * A single HTTP attempt. Deferred by WebClient, so every resubscription
     * from the retry issues a fresh request.
     */
    private Mono<AnalyticsQueryResponse> attempt(String endpoint, AnalyticsQueryRequest request,
                                                 Map<String, String> headers) {
        return webClient.post()
            .uri(endpoint)
            .headers(h -> headers.forEach(h::set))
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .exchangeToMono(this::handleResponse)
            .doOnSubscribe(s -> metrics.recordAttempt())
            .onErrorMap(WebClientRequestException.class, e -> new AnalyticsQueryException(
                "Analytics query transport error: " + e.getMessage(), AnalyticsQueryException.NO_STATUS, e));
    }

    private Mono<AnalyticsQueryResponse> handleResponse(ClientResponse response) {
        int status = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(AnalyticsQueryResponse.class)
                .defaultIfEmpty(AnalyticsQueryResponse.empty());
        }

        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .flatMap(body -> {
                AnalyticsQueryException error = classifier.classify(status, body);
                if (!error.isRetryable()) {
                    log.error("Analytics API error: {} {}", status, body);
                }
                return Mono.error(error);
            });
    }

    private Retry retryPolicy() {
        return Retry.fixedDelay(settings.maxAttempts() - 1L, settings.retryDelay())
            .filter(this::isRetryableError)
            .doBeforeRetry(signal -> {
                metrics.recordRetry();
                log.warn("Analytics query attempt {} failed ({}), retrying in {}",
                    signal.totalRetries() + 1, signal.failure().getMessage(), settings.retryDelay());
            })
            .onRetryExhaustedThrow((policy, signal) -> signal.failure());
    }

    /**
     * Throttled and server errors are recoverable; API and transport errors are not.
     */
    private boolean isRetryableError(Throwable throwable) {
        return throwable instanceof AnalyticsQueryException
            && ((AnalyticsQueryException) throwable).isRetryable();
    }

    private void logResponseNotes(AnalyticsQueryResponse response, String label) {
        if (label == null) {
            return;
        }
        if (response.hasWarnings()) {
            log.warn("Analytics {} query warnings: {}", label, response.getWarnings());
        }
        if (response.isLimitReached()) {
            log.warn("Analytics {} query limit reached - results may be truncated", label);
        }
    }
}
