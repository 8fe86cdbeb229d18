package com.prism.domain;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A queryable datasource: a physical table, or a raw SQL statement used as a
 * derived table, with its columns and metrics.
 *
 * Column and metric names are unique within a table; adding one with an
 * existing name replaces it.
 */
public class SqlTable {

    private final String tableName;
    private final Database database;
    private String schema;
    private String sql;
    private String mainDttmCol;
    private final Map<String, TableColumn> columns = new LinkedHashMap<>();
    private final Map<String, SqlMetric> metrics = new LinkedHashMap<>();

    public SqlTable(String tableName, Database database) {
        this.tableName = tableName;
        this.database = database;
    }

    public String getTableName() {
        return tableName;
    }

    public Database getDatabase() {
        return database;
    }

    public String getSchema() {
        return schema;
    }

    public void setSchema(String schema) {
        this.schema = schema;
    }

    /**
     * Raw SQL used in place of the physical table, or null
     */
    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public boolean hasSql() {
        return sql != null && !sql.isBlank();
    }

    public String getMainDttmCol() {
        return mainDttmCol;
    }

    public void setMainDttmCol(String mainDttmCol) {
        this.mainDttmCol = mainDttmCol;
    }

    public SqlTable addColumn(TableColumn column) {
        columns.put(column.getColumnName(), column);
        return this;
    }

    public SqlTable addMetric(SqlMetric metric) {
        metrics.put(metric.getMetricName(), metric);
        return this;
    }

    public Collection<TableColumn> getColumns() {
        return columns.values();
    }

    public Collection<SqlMetric> getMetrics() {
        return metrics.values();
    }

    public TableColumn getColumn(String columnName) {
        return columnName == null ? null : columns.get(columnName);
    }

    public SqlMetric getMetric(String metricName) {
        return metricName == null ? null : metrics.get(metricName);
    }

    /**
     * Qualified name: {@code schema.table} when a schema is set
     */
    public String getName() {
        if (schema == null || schema.isEmpty()) {
            return tableName;
        }
        return schema + "." + tableName;
    }

    /**
     * Names of the date-time columns, including the main time column
     */
    public List<String> getDttmCols() {
        List<String> names = columns.values().stream()
                .filter(TableColumn::isDttm)
                .map(TableColumn::getColumnName)
                .collect(Collectors.toCollection(ArrayList::new));
        if (mainDttmCol != null && !names.contains(mainDttmCol)) {
            names.add(mainDttmCol);
        }
        return names;
    }

    public String getAnyDttmCol() {
        List<String> cols = getDttmCols();
        return cols.isEmpty() ? null : cols.get(0);
    }

    public List<String> getNumCols() {
        return columns.values().stream()
                .filter(TableColumn::isNum)
                .map(TableColumn::getColumnName)
                .collect(Collectors.toList());
    }

    public Map<String, List<String>> getTimeColumnGrains() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        result.put("time_columns", getDttmCols());
        result.put("time_grains", database.getGrainNames());
        return result;
    }

    /**
     * (metric name, display label) pairs sorted by label
     */
    public List<Map.Entry<String, String>> getMetricsCombo() {
        return metrics.values().stream()
                .map(m -> (Map.Entry<String, String>) new AbstractMap.SimpleImmutableEntry<>(
                        m.getMetricName(),
                        m.getVerboseName() != null ? m.getVerboseName() : m.getMetricName()))
                .sorted(Comparator.comparing(Map.Entry::getValue))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return getName();
    }
}
