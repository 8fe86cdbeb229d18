package com.prism.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Declarative description of one analytical query.
 *
 * Groupby order defines output column order and the join key order of the
 * series-limiting subquery. The first metric is the default ordering metric.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryObject {

    @JsonProperty("granularity")
    private String granularity;

    @JsonProperty("from_dttm")
    private LocalDateTime fromDttm;

    @JsonProperty("to_dttm")
    private LocalDateTime toDttm;

    @JsonProperty("inner_from_dttm")
    private LocalDateTime innerFromDttm;

    @JsonProperty("inner_to_dttm")
    private LocalDateTime innerToDttm;

    @JsonProperty("is_timeseries")
    private boolean timeseries = true;

    @JsonProperty("groupby")
    private List<String> groupby = new ArrayList<>();

    @JsonProperty("metrics")
    private List<String> metrics = new ArrayList<>();

    @JsonProperty("columns")
    private List<String> columns = new ArrayList<>();

    @JsonProperty("filter")
    private List<QueryFilter> filter = new ArrayList<>();

    @JsonProperty("where")
    private String where;

    @JsonProperty("having")
    private String having;

    @JsonProperty("time_grain_sqla")
    private String timeGrain;

    @JsonProperty("row_limit")
    private Integer rowLimit;

    @JsonProperty("timeseries_limit")
    private Integer timeseriesLimit;

    @JsonProperty("timeseries_limit_metric")
    private String timeseriesLimitMetric;

    @JsonProperty("orderby")
    private List<SortField> orderby = new ArrayList<>();

    public QueryObject() {
    }

    /**
     * Shallow copy; list contents are copied into new lists
     */
    public QueryObject(QueryObject other) {
        this.granularity = other.granularity;
        this.fromDttm = other.fromDttm;
        this.toDttm = other.toDttm;
        this.innerFromDttm = other.innerFromDttm;
        this.innerToDttm = other.innerToDttm;
        this.timeseries = other.timeseries;
        this.groupby = new ArrayList<>(other.getGroupby());
        this.metrics = new ArrayList<>(other.getMetrics());
        this.columns = new ArrayList<>(other.getColumns());
        this.filter = new ArrayList<>(other.getFilter());
        this.where = other.where;
        this.having = other.having;
        this.timeGrain = other.timeGrain;
        this.rowLimit = other.rowLimit;
        this.timeseriesLimit = other.timeseriesLimit;
        this.timeseriesLimitMetric = other.timeseriesLimitMetric;
        this.orderby = new ArrayList<>(other.getOrderby());
    }

    public String getGranularity() {
        return granularity;
    }

    public void setGranularity(String granularity) {
        this.granularity = granularity;
    }

    public LocalDateTime getFromDttm() {
        return fromDttm;
    }

    public void setFromDttm(LocalDateTime fromDttm) {
        this.fromDttm = fromDttm;
    }

    public LocalDateTime getToDttm() {
        return toDttm;
    }

    public void setToDttm(LocalDateTime toDttm) {
        this.toDttm = toDttm;
    }

    public LocalDateTime getInnerFromDttm() {
        return innerFromDttm;
    }

    public void setInnerFromDttm(LocalDateTime innerFromDttm) {
        this.innerFromDttm = innerFromDttm;
    }

    public LocalDateTime getInnerToDttm() {
        return innerToDttm;
    }

    public void setInnerToDttm(LocalDateTime innerToDttm) {
        this.innerToDttm = innerToDttm;
    }

    @JsonIgnore
    public TimeRange getTimeRange() {
        return new TimeRange(fromDttm, toDttm);
    }

    /**
     * Window used by the series-limiting subquery; each bound falls back to the outer one
     */
    @JsonIgnore
    public TimeRange getInnerTimeRange() {
        return new TimeRange(
                innerFromDttm != null ? innerFromDttm : fromDttm,
                innerToDttm != null ? innerToDttm : toDttm);
    }

    public boolean isTimeseries() {
        return timeseries;
    }

    public void setTimeseries(boolean timeseries) {
        this.timeseries = timeseries;
    }

    public List<String> getGroupby() {
        return groupby == null ? List.of() : groupby;
    }

    public void setGroupby(List<String> groupby) {
        this.groupby = groupby;
    }

    public List<String> getMetrics() {
        return metrics == null ? List.of() : metrics;
    }

    public void setMetrics(List<String> metrics) {
        this.metrics = metrics;
    }

    public List<String> getColumns() {
        return columns == null ? List.of() : columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public List<QueryFilter> getFilter() {
        return filter == null ? List.of() : filter;
    }

    public void setFilter(List<QueryFilter> filter) {
        this.filter = filter;
    }

    public String getWhere() {
        return where;
    }

    public void setWhere(String where) {
        this.where = where;
    }

    public String getHaving() {
        return having;
    }

    public void setHaving(String having) {
        this.having = having;
    }

    public String getTimeGrain() {
        return timeGrain;
    }

    public void setTimeGrain(String timeGrain) {
        this.timeGrain = timeGrain;
    }

    public Integer getRowLimit() {
        return rowLimit;
    }

    public void setRowLimit(Integer rowLimit) {
        this.rowLimit = rowLimit;
    }

    public Integer getTimeseriesLimit() {
        return timeseriesLimit;
    }

    public void setTimeseriesLimit(Integer timeseriesLimit) {
        this.timeseriesLimit = timeseriesLimit;
    }

    public String getTimeseriesLimitMetric() {
        return timeseriesLimitMetric;
    }

    public void setTimeseriesLimitMetric(String timeseriesLimitMetric) {
        this.timeseriesLimitMetric = timeseriesLimitMetric;
    }

    public List<SortField> getOrderby() {
        return orderby == null ? List.of() : orderby;
    }

    public void setOrderby(List<SortField> orderby) {
        this.orderby = orderby;
    }
}
