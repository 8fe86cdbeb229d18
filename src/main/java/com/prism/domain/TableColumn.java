package com.prism.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * A logical column of a {@link SqlTable}.
 *
 * A column is either a physical column (no expression, the name is used as
 * the identifier) or a derived one whose {@code expression} is emitted
 * verbatim into generated SQL.
 */
public class TableColumn {

    /** Format hint: values are seconds since the Unix epoch */
    public static final String EPOCH_S = "epoch_s";

    /** Format hint: values are milliseconds since the Unix epoch */
    public static final String EPOCH_MS = "epoch_ms";

    private static final List<String> NUM_TYPES =
            List.of("DOUBLE", "FLOAT", "INT", "BIGINT", "LONG", "REAL", "NUMERIC", "DECIMAL", "NUMBER");
    private static final List<String> DATE_TYPES = List.of("DATE", "TIME");
    private static final List<String> STR_TYPES = List.of("VARCHAR", "STRING", "CHAR", "TEXT");

    @JsonProperty("column_name")
    private String columnName;

    @JsonProperty("verbose_name")
    private String verboseName;

    @JsonProperty("type")
    private String type;

    @JsonProperty("is_dttm")
    private boolean dttm;

    @JsonProperty("expression")
    private String expression;

    @JsonProperty("python_date_format")
    private String dateFormat;

    @JsonProperty("database_expression")
    private String databaseExpression;

    public TableColumn() {
    }

    public TableColumn(String columnName, String type) {
        this.columnName = columnName;
        this.type = type;
    }

    public String getColumnName() {
        return columnName;
    }

    public void setColumnName(String columnName) {
        this.columnName = columnName;
    }

    public String getVerboseName() {
        return verboseName;
    }

    public void setVerboseName(String verboseName) {
        this.verboseName = verboseName;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public boolean isDttm() {
        return dttm;
    }

    public void setDttm(boolean dttm) {
        this.dttm = dttm;
    }

    public String getExpression() {
        return expression;
    }

    public void setExpression(String expression) {
        this.expression = expression;
    }

    public boolean hasExpression() {
        return expression != null && !expression.isEmpty();
    }

    /**
     * DateTimeFormatter pattern, or one of {@link #EPOCH_S} / {@link #EPOCH_MS}
     */
    public String getDateFormat() {
        return dateFormat;
    }

    public void setDateFormat(String dateFormat) {
        this.dateFormat = dateFormat;
    }

    /**
     * Conversion template with a single {@code {}} site that receives the
     * instant formatted as {@code yyyy-MM-dd HH:mm:ss}
     */
    public String getDatabaseExpression() {
        return databaseExpression;
    }

    public void setDatabaseExpression(String databaseExpression) {
        this.databaseExpression = databaseExpression;
    }

    @JsonIgnore
    public boolean isNum() {
        return typeMatches(NUM_TYPES);
    }

    @JsonIgnore
    public boolean isString() {
        return typeMatches(STR_TYPES);
    }

    @JsonIgnore
    public boolean isTime() {
        return typeMatches(DATE_TYPES);
    }

    @JsonIgnore
    public ColumnType getTypeClass() {
        if (isNum()) {
            return ColumnType.NUMERIC;
        }
        if (isTime()) {
            return ColumnType.TEMPORAL;
        }
        if (isString()) {
            return ColumnType.STRING;
        }
        return ColumnType.UNKNOWN;
    }

    private boolean typeMatches(List<String> candidates) {
        if (type == null) {
            return false;
        }
        String upper = type.toUpperCase(Locale.ROOT);
        return candidates.stream().anyMatch(upper::contains);
    }

    @Override
    public String toString() {
        return columnName;
    }
}
