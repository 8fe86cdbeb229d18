package com.prism.dialect;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for EngineSpecRegistry
 */
class EngineSpecRegistryTest {

    private EngineSpecRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EngineSpecRegistry();
        registry.registerEngineSpecs();
    }

    @Test
    void testLookupByEngineNameAndAlias() {
        assertThat(registry.getSpec("postgresql")).isInstanceOf(PostgresEngineSpec.class);
        assertThat(registry.getSpec("postgres")).isInstanceOf(PostgresEngineSpec.class);
        assertThat(registry.getSpec("MySQL")).isInstanceOf(MySqlEngineSpec.class);
        assertThat(registry.getSpec("mariadb")).isInstanceOf(MySqlEngineSpec.class);
        assertThat(registry.getSpec(" trino ")).isInstanceOf(PrestoEngineSpec.class);
        assertThat(registry.getSpec("sqlite")).isInstanceOf(SqliteEngineSpec.class);
        assertThat(registry.getSpec("h2")).isInstanceOf(H2EngineSpec.class);
    }

    @Test
    void testUnknownEngineFallsBackToDefault() {
        assertThat(registry.getSpec("oracle").getEngine()).isEqualTo("base");
        assertThat(registry.getSpec(null)).isSameAs(registry.getDefaultSpec());
        assertThat(registry.getSpec("")).isSameAs(registry.getDefaultSpec());
    }

    @Test
    void testLookupByJdbcUrl() {
        assertThat(registry.getSpecForJdbcUrl("jdbc:postgresql://localhost:5432/db"))
                .isInstanceOf(PostgresEngineSpec.class);
        assertThat(registry.getSpecForJdbcUrl("jdbc:mysql://localhost/db"))
                .isInstanceOf(MySqlEngineSpec.class);
        assertThat(registry.getSpecForJdbcUrl("jdbc:h2:mem:test"))
                .isInstanceOf(H2EngineSpec.class);
        assertThat(registry.getSpecForJdbcUrl("postgresql://localhost"))
                .isSameAs(registry.getDefaultSpec());
        assertThat(registry.getSpecForJdbcUrl(null))
                .isSameAs(registry.getDefaultSpec());
    }

    @Test
    void testDefaultSpecCanBeReplaced() {
        H2EngineSpec h2 = new H2EngineSpec();
        registry.setDefaultSpec(h2);

        assertThat(registry.getSpec("unknown")).isSameAs(h2);
    }

    @Test
    void testDefaultSpecReplacedFromAnotherThreadIsSeen() throws Exception {
        // Given: The default replaced by a configuration thread
        MySqlEngineSpec mysql = new MySqlEngineSpec();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> registry.setDefaultSpec(mysql)).get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdown();
        }

        // When/Then: Lookups on this thread resolve to the new default
        assertThat(registry.getDefaultSpec()).isSameAs(mysql);
        assertThat(registry.getSpecForJdbcUrl("jdbc:unknown:db")).isSameAs(mysql);
        assertThat(Modifier.isVolatile(EngineSpecRegistry.class.getDeclaredField("defaultSpec").getModifiers()))
                .isTrue();
    }
}
