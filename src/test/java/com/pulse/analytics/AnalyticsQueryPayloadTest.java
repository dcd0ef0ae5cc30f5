package com.pulse.analytics;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyticsQueryPayloadTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testRequestBodyShape() throws Exception {
        String json = objectMapper.writeValueAsString(new AnalyticsQueryRequest("HogQLQuery", "SELECT 1"));

        assertThat(json).isEqualTo("{\"query\":{\"kind\":\"HogQLQuery\",\"query\":\"SELECT 1\"}}");
    }

    @Test
    void testResponseIgnoresUnknownFields() throws Exception {
        AnalyticsQueryResponse response = objectMapper.readValue(
            "{\"results\":[[\"2024-01-01\",12]],\"columns\":[\"day\",\"n\"],\"hogql\":\"...\",\"limit_reached\":false}",
            AnalyticsQueryResponse.class);

        assertThat(response.getResults()).hasSize(1);
        assertThat(response.getResults().get(0)).containsExactly("2024-01-01", 12);
        assertThat(response.isLimitReached()).isFalse();
        assertThat(response.hasWarnings()).isFalse();
    }

    @Test
    void testNullResultsReadAsEmpty() throws Exception {
        AnalyticsQueryResponse response = objectMapper.readValue("{\"results\":null}", AnalyticsQueryResponse.class);

        assertThat(response.getResults()).isEmpty();
    }
}
