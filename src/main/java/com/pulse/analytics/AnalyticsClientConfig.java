package com.pulse.analytics;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wiring for the hosted analytics client.
 * One limiter instance is shared by every query issued by this process.
 */
@Configuration
public class AnalyticsClientConfig {
    private static final Logger logger = LoggerFactory.getLogger(AnalyticsClientConfig.class);

    @Value("${pulse.analytics.host:https://us.i.posthog.com}")
    private String host;

    @Value("${pulse.analytics.project-id:}")
    private String projectId;

    @Value("${pulse.analytics.api-key:}")
    private String apiKey;

    @Value("${pulse.analytics.query-kind:HogQLQuery}")
    private String queryKind;

    @Value("${pulse.analytics.max-concurrent:3}")
    private int maxConcurrent;

    @Value("${pulse.analytics.max-attempts:2}")
    private int maxAttempts;

    @Value("${pulse.analytics.retry-delay:2s}")
    private Duration retryDelay;

    @Bean
    public AnalyticsServiceSettings analyticsServiceSettings() {
        return new AnalyticsServiceSettings(host, projectId, apiKey, queryKind, maxAttempts, retryDelay);
    }

    @Bean
    public ConcurrencyLimiter analyticsConcurrencyLimiter() {
        return new ConcurrencyLimiter("analytics", maxConcurrent);
    }

    @Bean
    public AnalyticsClientMetrics analyticsClientMetrics(MeterRegistry meterRegistry,
                                                         ConcurrencyLimiter analyticsConcurrencyLimiter) {
        AnalyticsClientMetrics metrics = new AnalyticsClientMetrics(meterRegistry);
        metrics.bindLimiter(analyticsConcurrencyLimiter);
        return metrics;
    }

    @Bean
    public QueryErrorClassifier queryErrorClassifier(ObjectMapper objectMapper) {
        return new QueryErrorClassifier(objectMapper);
    }

    @Bean
    public AnalyticsQueryClient analyticsQueryClient(
            WebClient.Builder webClientBuilder,
            ConcurrencyLimiter analyticsConcurrencyLimiter,
            QueryErrorClassifier queryErrorClassifier,
            AnalyticsClientMetrics analyticsClientMetrics,
            AnalyticsServiceSettings analyticsServiceSettings) {
        logger.info("Creating analytics query client (host={}, maxConcurrent={})", host, maxConcurrent);
        return new AnalyticsQueryClientRestImpl(
            webClientBuilder.build(),
            analyticsConcurrencyLimiter,
            queryErrorClassifier,
            analyticsClientMetrics,
            analyticsServiceSettings);
    }
}
