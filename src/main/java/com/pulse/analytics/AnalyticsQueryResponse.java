package com.pulse.analytics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Successful response of the hosted query endpoint. Only the fields the
 * dashboard uses are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyticsQueryResponse {

    @JsonProperty("results")
    private List<List<Object>> results;

    @JsonProperty("warnings")
    private List<Object> warnings;

    @JsonProperty("limit_reached")
    private boolean limitReached;

    public AnalyticsQueryResponse() {
        this.results = new ArrayList<>();
    }

    public AnalyticsQueryResponse(List<List<Object>> results) {
        this.results = results;
    }

    public static AnalyticsQueryResponse empty() {
        return new AnalyticsQueryResponse(new ArrayList<>());
    }

    /**
     * @return result rows, never null
     */
    public List<List<Object>> getResults() {
        return results != null ? results : new ArrayList<>();
    }

    public void setResults(List<List<Object>> results) {
        this.results = results;
    }

    public List<Object> getWarnings() {
        return warnings;
    }

    public void setWarnings(List<Object> warnings) {
        this.warnings = warnings;
    }

    public boolean isLimitReached() {
        return limitReached;
    }

    public void setLimitReached(boolean limitReached) {
        this.limitReached = limitReached;
    }

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }
}
