package com.prism.query.sql;

/**
 * Wraps a clause in parentheses
 */
public class Grouping implements SqlClause {

    private final SqlClause element;

    public Grouping(SqlClause element) {
        this.element = element;
    }

    public SqlClause getElement() {
        return element;
    }
}
