package com.pulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Pulse reporting dashboard back end.
 *
 * Pulse answers analytics questions by rendering checked-in query templates
 * against the relational store and against the hosted event-analytics query
 * service, then hands the rows to the route layer for display.
 *
 * Core pieces:
 * - Relational (SQL) and analytics-dialect (HogQL) template renderers
 * - Ambient per-request context carrying timezone and user filter flags
 * - Concurrency-limited, retrying client for the hosted query service
 */
@SpringBootApplication
public class PulseApplication {

    /**
     * Main entry point for the Pulse back end.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(PulseApplication.class, args);
    }
}
