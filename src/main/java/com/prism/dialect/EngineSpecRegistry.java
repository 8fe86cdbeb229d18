package com.prism.dialect;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of engine specs by engine name.
 * Unknown engines resolve to the generic {@link BaseEngineSpec}.
 */
@Component
public class EngineSpecRegistry {

    private static final Logger logger = LoggerFactory.getLogger(EngineSpecRegistry.class);

    private final Map<String, BaseEngineSpec> specs = new ConcurrentHashMap<>();
    private volatile BaseEngineSpec defaultSpec = new BaseEngineSpec();

    @PostConstruct
    public void registerEngineSpecs() {
        register(new PostgresEngineSpec(), "postgres");
        register(new MySqlEngineSpec(), "mariadb");
        register(new SqliteEngineSpec());
        register(new PrestoEngineSpec(), "trino");
        register(new H2EngineSpec());
        logger.info("Registered engine specs: {}", specs.keySet());
    }

    /**
     * Registers a spec under its engine name and any aliases
     */
    public void register(BaseEngineSpec spec, String... aliases) {
        specs.put(spec.getEngine(), spec);
        for (String alias : aliases) {
            specs.put(alias.toLowerCase(Locale.ROOT), spec);
        }
    }

    /**
     * Gets the spec for an engine name, or the default spec if not found
     */
    public BaseEngineSpec getSpec(String engine) {
        if (engine == null || engine.isBlank()) {
            return defaultSpec;
        }
        return specs.getOrDefault(engine.trim().toLowerCase(Locale.ROOT), defaultSpec);
    }

    /**
     * Resolves the spec from a JDBC URL such as {@code jdbc:postgresql://host/db}
     */
    public BaseEngineSpec getSpecForJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.toLowerCase(Locale.ROOT).startsWith("jdbc:")) {
            logger.debug("Not a JDBC URL, using default engine spec: {}", jdbcUrl);
            return defaultSpec;
        }
        String rest = jdbcUrl.substring("jdbc:".length());
        int end = rest.indexOf(':');
        String engine = end < 0 ? rest : rest.substring(0, end);
        return getSpec(engine);
    }

    public BaseEngineSpec getDefaultSpec() {
        return defaultSpec;
    }

    public void setDefaultSpec(BaseEngineSpec defaultSpec) {
        this.defaultSpec = defaultSpec;
    }
}
