package com.pulse.analytics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Metrics for calls to the hosted analytics service: attempts, retries,
 * failures by class, latency, and limiter occupancy.
 */
public class AnalyticsClientMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter attempts;
    private final Counter retries;
    private final Counter throttled;
    private final Counter serverErrors;
    private final Counter failures;
    private final Counter unconfigured;
    private final Timer queryLatency;

    public AnalyticsClientMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        attempts = Counter.builder("pulse.analytics.query.attempts")
            .description("HTTP attempts made against the hosted analytics service")
            .register(meterRegistry);

        retries = Counter.builder("pulse.analytics.query.retries")
            .description("Attempts retried after a throttled or server error response")
            .register(meterRegistry);

        throttled = Counter.builder("pulse.analytics.query.throttled")
            .description("Queries that failed as throttled after all attempts")
            .register(meterRegistry);

        serverErrors = Counter.builder("pulse.analytics.query.server.errors")
            .description("Queries that failed with a server error after all attempts")
            .register(meterRegistry);

        failures = Counter.builder("pulse.analytics.query.failures")
            .description("Queries that failed with a non-retryable error")
            .register(meterRegistry);

        unconfigured = Counter.builder("pulse.analytics.query.unconfigured")
            .description("Queries skipped because the hosted service is not configured")
            .register(meterRegistry);

        queryLatency = Timer.builder("pulse.analytics.query.latency")
            .description("Latency of logical analytics queries, including retries")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofSeconds(60))
            .register(meterRegistry);
    }

    /**
     * Exposes limiter occupancy as gauges.
     */
    public void bindLimiter(ConcurrencyLimiter limiter) {
        Gauge.builder("pulse.analytics.limiter.in.use", limiter, ConcurrencyLimiter::inUse)
            .description("Slots of the analytics concurrency limiter currently held")
            .register(meterRegistry);
        Gauge.builder("pulse.analytics.limiter.queued", limiter, ConcurrencyLimiter::queued)
            .description("Callers waiting for an analytics concurrency limiter slot")
            .register(meterRegistry);
    }

    public void recordAttempt() {
        attempts.increment();
    }

    public void recordRetry() {
        retries.increment();
    }

    public void recordFailure(AnalyticsQueryException e) {
        if (e instanceof ThrottledQueryException) {
            throttled.increment();
        } else if (e instanceof ServerQueryException) {
            serverErrors.increment();
        } else {
            failures.increment();
        }
    }

    public void recordUnconfigured() {
        unconfigured.increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordLatency(Timer.Sample sample) {
        sample.stop(queryLatency);
    }
}
