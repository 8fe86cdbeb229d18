package com.prism.template;

import com.prism.domain.SqlTable;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values available to template expressions while one query is compiled
 */
public class TemplateContext {

    private static final DateTimeFormatter DTTM_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final SqlTable table;
    private final LocalDateTime fromDttm;
    private final LocalDateTime toDttm;
    private final Integer rowLimit;
    private final List<String> groupby;
    private final List<String> metrics;

    public TemplateContext(SqlTable table, LocalDateTime fromDttm, LocalDateTime toDttm,
                           Integer rowLimit, List<String> groupby, List<String> metrics) {
        this.table = table;
        this.fromDttm = fromDttm;
        this.toDttm = toDttm;
        this.rowLimit = rowLimit;
        this.groupby = groupby != null ? groupby : List.of();
        this.metrics = metrics != null ? metrics : List.of();
    }

    public SqlTable getTable() {
        return table;
    }

    public LocalDateTime getFromDttm() {
        return fromDttm;
    }

    public LocalDateTime getToDttm() {
        return toDttm;
    }

    public Integer getRowLimit() {
        return rowLimit;
    }

    public List<String> getGroupby() {
        return groupby;
    }

    public List<String> getMetrics() {
        return metrics;
    }

    /**
     * Context as text values keyed by expression name. Absent values are left out.
     */
    public Map<String, String> asVariables() {
        Map<String, String> variables = new LinkedHashMap<>();
        if (table != null) {
            variables.put("table_name", table.getTableName());
            putIfPresent(variables, "schema", table.getSchema());
            if (table.getDatabase() != null) {
                putIfPresent(variables, "database", table.getDatabase().getDatabaseName());
            }
        }
        if (fromDttm != null) {
            variables.put("from_dttm", DTTM_FORMAT.format(fromDttm));
        }
        if (toDttm != null) {
            variables.put("to_dttm", DTTM_FORMAT.format(toDttm));
        }
        if (rowLimit != null) {
            variables.put("row_limit", rowLimit.toString());
        }
        variables.put("groupby", String.join(", ", new ArrayList<>(groupby)));
        variables.put("metrics", String.join(", ", new ArrayList<>(metrics)));
        return variables;
    }

    private static void putIfPresent(Map<String, String> variables, String key, String value) {
        if (value != null) {
            variables.put(key, value);
        }
    }
}
