package com.pulse.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Runs rendered SQL against the reporting database and returns rows as
 * column-name maps. Blocking; callers on a reactive path must move it
 * off the event loop.
 */
@Component
public class SqlQueryRunner {

    private static final Logger log = LoggerFactory.getLogger(SqlQueryRunner.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public SqlQueryRunner(@Qualifier("reportingJdbcTemplate") JdbcTemplate jdbcTemplate,
                          ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * @param sql    final query text, positional {@code ?} parameters allowed
     * @param params values bound to the positional parameters
     * @return rows in result order, each keyed by column label
     * @throws QueryExecutionException if the database rejects or times out the query
     */
    public List<Map<String, Object>> run(String sql, Object... params) {
        long start = System.currentTimeMillis();
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, params);
            log.debug("Query returned {} rows in {}ms", rows.size(), System.currentTimeMillis() - start);
            return rows;
        } catch (DataAccessException e) {
            String paramsJson = toJson(params);
            String message = e.getMostSpecificCause().getMessage();
            log.error("Database query failed: {}\nQuery: {}\nParams: {}", message, sql, paramsJson);
            throw new QueryExecutionException(message, sql, paramsJson, e);
        }
    }

    private String toJson(Object[] params) {
        Object[] values = params != null ? params : new Object[0];
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize query params as JSON", e);
            return Arrays.toString(values);
        }
    }
}
