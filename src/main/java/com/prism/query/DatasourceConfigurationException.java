package com.prism.query;

/**
 * The table metadata cannot support the requested query, e.g. a time series
 * over a table without any time column
 */
public class DatasourceConfigurationException extends QueryCompilationException {

    public DatasourceConfigurationException(String message, String datasource) {
        super(message, datasource);
    }

    public DatasourceConfigurationException(String message, String datasource, Throwable cause) {
        super(message, datasource, cause);
    }
}
