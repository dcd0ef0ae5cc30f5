package com.pulse.analytics;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyticsServiceSettingsTest {

    @Test
    void testQueryEndpoint() {
        AnalyticsServiceSettings settings = new AnalyticsServiceSettings(
            "https://us.i.posthog.com/", "1234", "key", "HogQLQuery", 2, Duration.ofSeconds(2));

        assertThat(settings.queryEndpoint()).isEqualTo("https://us.i.posthog.com/api/projects/1234/query/");
    }

    @Test
    void testConfiguredRequiresProjectAndKey() {
        assertThat(settings("1234", "key").isConfigured()).isTrue();
        assertThat(settings("", "key").isConfigured()).isFalse();
        assertThat(settings("1234", " ").isConfigured()).isFalse();
        assertThat(settings(null, null).isConfigured()).isFalse();
    }

    @Test
    void testInvalidRetrySettings() {
        assertThatThrownBy(() -> new AnalyticsServiceSettings(
                AnalyticsServiceSettings.DEFAULT_HOST, "1", "k", "HogQLQuery", 0, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnalyticsServiceSettings(
                AnalyticsServiceSettings.DEFAULT_HOST, "1", "k", "HogQLQuery", 2, Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static AnalyticsServiceSettings settings(String projectId, String apiKey) {
        return new AnalyticsServiceSettings(AnalyticsServiceSettings.DEFAULT_HOST, projectId, apiKey,
            AnalyticsServiceSettings.DEFAULT_QUERY_KIND, AnalyticsServiceSettings.DEFAULT_MAX_ATTEMPTS,
            AnalyticsServiceSettings.DEFAULT_RETRY_DELAY);
    }
}
