package com.prism.query;

/**
 * The query description references something the table does not define,
 * or carries a value that cannot be used
 */
public class QueryValidationException extends QueryCompilationException {

    private final String invalidValue;

    public QueryValidationException(String message, String datasource, String invalidValue) {
        super(message, datasource);
        this.invalidValue = invalidValue;
    }

    public QueryValidationException(String message, String datasource, String invalidValue, Throwable cause) {
        super(message, datasource, cause);
        this.invalidValue = invalidValue;
    }

    /**
     * The offending metric name, column name or filter value
     */
    public String getInvalidValue() {
        return invalidValue;
    }
}
