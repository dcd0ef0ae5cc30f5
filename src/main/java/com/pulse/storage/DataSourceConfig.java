package com.pulse.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Configuration for the reporting PostgreSQL connection.
 * Every statement runs under a server-side timeout.
 */
@Configuration
public class DataSourceConfig {
    private static final Logger logger = LoggerFactory.getLogger(DataSourceConfig.class);

    @Value("${pulse.datasource.url:jdbc:postgresql://localhost:5432/pulse}")
    private String url;

    @Value("${pulse.datasource.username:postgres}")
    private String username;

    @Value("${pulse.datasource.password:}")
    private String password;

    @Value("${pulse.datasource.pool.size:10}")
    private int poolSize;

    @Value("${pulse.datasource.ssl:true}")
    private boolean ssl;

    @Value("${pulse.datasource.statement-timeout-seconds:30}")
    private int statementTimeoutSeconds;

    /**
     * Create the reporting DataSource with connection pooling
     */
    @Bean(name = "reportingDataSource")
    public DataSource reportingDataSource() {
        try {
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(url);
            config.setUsername(username);
            config.setPassword(password);
            config.setDriverClassName("org.postgresql.Driver");
            config.setPoolName("pulse-reporting");

            // Connection pool settings
            config.setMaximumPoolSize(poolSize);
            config.setMinimumIdle(2);
            config.setConnectionTimeout(30000);
            config.setIdleTimeout(600000);
            config.setMaxLifetime(1800000);
            // Start without a database; the first query reports the failure
            config.setInitializationFailTimeout(-1);

            // PostgreSQL-specific settings
            config.addDataSourceProperty("ssl", String.valueOf(ssl));
            if (ssl) {
                config.addDataSourceProperty("sslmode", "require");
            }
            config.addDataSourceProperty("options", "-c statement_timeout=" + (statementTimeoutSeconds * 1000L));

            HikariDataSource dataSource = new HikariDataSource(config);

            logger.info("Reporting DataSource initialized: {} (statement timeout {}s)", url, statementTimeoutSeconds);
            return dataSource;

        } catch (Exception e) {
            logger.error("Failed to initialize reporting DataSource", e);
            throw new IllegalStateException("Reporting DataSource initialization failed", e);
        }
    }

    /**
     * Create JdbcTemplate for report queries
     */
    @Bean(name = "reportingJdbcTemplate")
    public JdbcTemplate reportingJdbcTemplate(DataSource reportingDataSource) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(reportingDataSource);
        jdbcTemplate.setQueryTimeout(statementTimeoutSeconds);
        return jdbcTemplate;
    }
}
