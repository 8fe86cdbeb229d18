package com.prism.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Represents the result of executing one compiled query.
 * Success and failure are both reported through this object.
 */
public class QueryResult {

    @JsonProperty("status")
    private final QueryStatus status;

    @JsonProperty("rows")
    private final List<Map<String, Object>> rows;

    @JsonIgnore
    private final Duration duration;

    @JsonProperty("query")
    private final String query;

    @JsonProperty("error_message")
    private final String errorMessage;

    public QueryResult(QueryStatus status, List<Map<String, Object>> rows, Duration duration,
                       String query, String errorMessage) {
        this.status = status;
        this.rows = rows;
        this.duration = duration;
        this.query = query;
        this.errorMessage = errorMessage;
    }

    public static QueryResult success(List<Map<String, Object>> rows, Duration duration, String query) {
        return new QueryResult(QueryStatus.SUCCESS, rows != null ? rows : new ArrayList<>(), duration, query, null);
    }

    public static QueryResult failure(String errorMessage, Duration duration, String query) {
        return new QueryResult(QueryStatus.FAILED, null, duration, query, errorMessage);
    }

    public QueryStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == QueryStatus.SUCCESS;
    }

    /**
     * Result rows, or null when the execution failed
     */
    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows == null ? 0 : rows.size();
    }

    public Duration getDuration() {
        return duration;
    }

    @JsonProperty("duration_ms")
    public long getDurationMs() {
        return duration == null ? 0 : duration.toMillis();
    }

    public String getQuery() {
        return query;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
