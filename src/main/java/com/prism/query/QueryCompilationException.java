package com.prism.query;

/**
 * Thrown when a query description cannot be compiled against a table.
 * Nothing is executed once this is raised.
 */
public class QueryCompilationException extends RuntimeException {

    private final String datasource;

    public QueryCompilationException(String message, String datasource) {
        super(message);
        this.datasource = datasource;
    }

    public QueryCompilationException(String message, String datasource, Throwable cause) {
        super(message, cause);
        this.datasource = datasource;
    }

    /**
     * Qualified name of the table being compiled, if known
     */
    public String getDatasource() {
        return datasource;
    }
}
