package com.prism.query;

import java.util.Collections;
import java.util.Map;

/**
 * SQL text produced by {@link SqlQueryCompiler}.
 *
 * All values are inlined as literals, so the parameter map is always empty;
 * it is kept so callers can hand the statement to APIs that expect bindings.
 * {@link #getSql()} and {@link #getCompactSql()} are what JDBC runs.
 */
public class CompiledQuery {

    private final String sql;
    private final String compactSql;
    private final String formatStyleSql;
    private final String engine;
    private final Map<String, Object> parameters;

    public CompiledQuery(String sql, String compactSql, String engine) {
        this(sql, compactSql, compactSql, engine);
    }

    public CompiledQuery(String sql, String compactSql, String formatStyleSql, String engine) {
        this.sql = sql;
        this.compactSql = compactSql;
        this.formatStyleSql = formatStyleSql;
        this.engine = engine;
        this.parameters = Collections.emptyMap();
    }

    /**
     * Reindented statement, one clause per line
     */
    public String getSql() {
        return sql;
    }

    /**
     * The same statement on a single line
     */
    public String getCompactSql() {
        return compactSql;
    }

    /**
     * Single-line statement for drivers that treat {@code %} as a parameter
     * marker: percent signs in literal text are doubled, except in date-time
     * grain expressions. Identical to the compact form on other engines.
     */
    public String getFormatStyleSql() {
        return formatStyleSql;
    }

    public String getEngine() {
        return engine;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return compactSql;
    }
}
