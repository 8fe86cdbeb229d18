package com.prism.query;

/**
 * Exception thrown when running compiled SQL fails
 * Provides context about which datasource failed and the statement that was sent
 */
public class QueryExecutionException extends RuntimeException {

    private final String datasource;
    private final String query;

    public QueryExecutionException(String message, String datasource) {
        super(message);
        this.datasource = datasource;
        this.query = null;
    }

    public QueryExecutionException(String message, String datasource, String query, Throwable cause) {
        super(message, cause);
        this.datasource = datasource;
        this.query = query;
    }

    public String getDatasource() {
        return datasource;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (datasource != null) {
            sb.append(" [Datasource: ").append(datasource).append("]");
        }
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}
