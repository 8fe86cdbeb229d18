package com.prism.query.sql;

/**
 * A physical table, optionally schema qualified
 */
public class TableRef implements FromClause {

    private final String schema;
    private final String name;

    public TableRef(String schema, String name) {
        this.schema = schema;
        this.name = name;
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }
}
