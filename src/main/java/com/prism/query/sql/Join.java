package com.prism.query.sql;

/**
 * Inner join of a source with an aliased subquery
 */
public class Join implements FromClause {

    private final FromClause left;
    private final Select subquery;
    private final String alias;
    private final SqlClause onClause;

    public Join(FromClause left, Select subquery, String alias, SqlClause onClause) {
        this.left = left;
        this.subquery = subquery;
        this.alias = alias;
        this.onClause = onClause;
    }

    public FromClause getLeft() {
        return left;
    }

    public Select getSubquery() {
        return subquery;
    }

    public String getAlias() {
        return alias;
    }

    public SqlClause getOnClause() {
        return onClause;
    }
}
