package com.pulse.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for the hosted query endpoint:
 * {@code {"query": {"kind": "HogQLQuery", "query": "SELECT ..."}}}.
 */
public class AnalyticsQueryRequest {

    @JsonProperty("query")
    private final Query query;

    public AnalyticsQueryRequest(String kind, String queryText) {
        this.query = new Query(kind, queryText);
    }

    public Query getQuery() {
        return query;
    }

    public static class Query {

        @JsonProperty("kind")
        private final String kind;

        @JsonProperty("query")
        private final String query;

        public Query(String kind, String query) {
            this.kind = kind;
            this.query = query;
        }

        public String getKind() {
            return kind;
        }

        public String getQuery() {
            return query;
        }
    }
}
