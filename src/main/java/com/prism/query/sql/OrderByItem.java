package com.prism.query.sql;

/**
 * A sort key with direction
 */
public class OrderByItem {

    private final SqlClause element;
    private final boolean ascending;

    public OrderByItem(SqlClause element, boolean ascending) {
        this.element = element;
        this.ascending = ascending;
    }

    public static OrderByItem asc(SqlClause element) {
        return new OrderByItem(element, true);
    }

    public static OrderByItem desc(SqlClause element) {
        return new OrderByItem(element, false);
    }

    public SqlClause getElement() {
        return element;
    }

    public boolean isAscending() {
        return ascending;
    }
}
