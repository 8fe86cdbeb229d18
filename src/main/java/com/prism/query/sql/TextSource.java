package com.prism.query.sql;

/**
 * Raw SQL used as a derived table: {@code (sql) AS alias}
 */
public class TextSource implements FromClause {

    private final String sql;
    private final String alias;

    public TextSource(String sql, String alias) {
        this.sql = sql;
        this.alias = alias;
    }

    public String getSql() {
        return sql;
    }

    public String getAlias() {
        return alias;
    }
}
