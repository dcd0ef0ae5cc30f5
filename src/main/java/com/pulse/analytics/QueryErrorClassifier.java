package com.pulse.analytics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Turns a failed hosted-service response into the matching exception.
 *
 * Throttled: status 429, {@code type == "throttled_error"} or {@code code == "throttled"}.
 * Server error: status 5xx, {@code type == "server_error"} or {@code code == "error"}.
 * Anything else is a plain {@link AnalyticsQueryException} carrying the body's
 * {@code detail}, the raw body, or a generic status message.
 */
public class QueryErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(QueryErrorClassifier.class);

    private final ObjectMapper objectMapper;

    public QueryErrorClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AnalyticsQueryException classify(int status, String body) {
        JsonNode json = parse(body);
        String type = text(json, "type");
        String code = text(json, "code");

        if (status == 429 || "throttled_error".equals(type) || "throttled".equals(code)) {
            return new ThrottledQueryException(status);
        }
        if ((status >= 500 && status < 600) || "server_error".equals(type) || "error".equals(code)) {
            return new ServerQueryException(status);
        }

        String detail = text(json, "detail");
        String message;
        if (detail != null && !detail.isEmpty()) {
            message = detail;
        } else if (body != null && !body.isEmpty()) {
            message = body;
        } else {
            message = "API error: " + status;
        }
        return new AnalyticsQueryException(message, status);
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null && node.isObject() ? node : null;
        } catch (IOException e) {
            log.trace("Error body is not JSON: {}", e.getMessage());
            return null;
        }
    }

    private static String text(JsonNode json, String field) {
        if (json == null) {
            return null;
        }
        JsonNode value = json.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
