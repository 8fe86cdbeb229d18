package com.prism.config;

import com.prism.dialect.BaseEngineSpec;
import com.prism.dialect.EngineSpecRegistry;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the default JDBC connection queries run against
 * Manages the connection pool and the engine spec matching it
 */
@Configuration
public class QueryEngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngineConfig.class);

    @Value("${prism.datasource.url:jdbc:h2:mem:prism;DB_CLOSE_DELAY=-1}")
    private String url;

    @Value("${prism.datasource.username:sa}")
    private String username;

    @Value("${prism.datasource.password:}")
    private String password;

    @Value("${prism.datasource.pool.size:10}")
    private int poolSize;

    @Value("${prism.datasource.engine:}")
    private String engine;

    /**
     * Create the query DataSource with connection pooling
     */
    @Bean(name = "prismDataSource")
    public DataSource prismDataSource() {
        try {
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(url);
            config.setUsername(username);
            config.setPassword(password);

            // Connection pool settings
            config.setMaximumPoolSize(poolSize);
            config.setMinimumIdle(1);
            config.setConnectionTimeout(30000);
            config.setIdleTimeout(600000);
            config.setMaxLifetime(1800000);

            HikariDataSource dataSource = new HikariDataSource(config);

            logger.info("Query DataSource initialized: {}", url);
            return dataSource;

        } catch (Exception e) {
            logger.error("Failed to initialize query DataSource", e);
            throw new RuntimeException("Query DataSource initialization failed", e);
        }
    }

    /**
     * Create JdbcTemplate for query execution
     */
    @Bean(name = "prismJdbcTemplate")
    public JdbcTemplate prismJdbcTemplate(DataSource prismDataSource) {
        return new JdbcTemplate(prismDataSource);
    }

    /**
     * Engine spec of the default connection: the configured engine name, else derived from the URL
     */
    @Bean
    public BaseEngineSpec defaultEngineSpec(EngineSpecRegistry registry) {
        BaseEngineSpec spec = engine == null || engine.isBlank()
                ? registry.getSpecForJdbcUrl(url)
                : registry.getSpec(engine);
        registry.setDefaultSpec(spec);
        logger.info("Default engine spec: {}", spec.getEngine());
        return spec;
    }
}
