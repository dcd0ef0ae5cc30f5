package com.pulse.analytics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyticsClientMetricsTest {

    private SimpleMeterRegistry registry;
    private AnalyticsClientMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AnalyticsClientMetrics(registry);
    }

    @Test
    void testFailuresAreCountedByClass() {
        metrics.recordFailure(new ThrottledQueryException(429));
        metrics.recordFailure(new ServerQueryException(502));
        metrics.recordFailure(new ServerQueryException(503));
        metrics.recordFailure(new AnalyticsQueryException("bad query", 400));

        assertThat(registry.get("pulse.analytics.query.throttled").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("pulse.analytics.query.server.errors").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("pulse.analytics.query.failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testLimiterGauges() {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("analytics", 1);
        metrics.bindLimiter(limiter);

        limiter.acquire().subscribe();
        limiter.acquire().subscribe();

        assertThat(registry.get("pulse.analytics.limiter.in.use").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("pulse.analytics.limiter.queued").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void testLatencyTimer() {
        metrics.recordLatency(metrics.startTimer());

        assertThat(registry.get("pulse.analytics.query.latency").timer().count()).isEqualTo(1);
    }
}
