package com.prism.query;

import com.prism.dialect.BaseEngineSpec;
import com.prism.domain.SqlTable;
import com.prism.domain.TableColumn;
import com.prism.query.sql.BinaryClause;
import com.prism.query.sql.BooleanClauseList;
import com.prism.query.sql.ColumnClause;
import com.prism.query.sql.FromClause;
import com.prism.query.sql.Grouping;
import com.prism.query.sql.InClause;
import com.prism.query.sql.Join;
import com.prism.query.sql.Label;
import com.prism.query.sql.OrderByItem;
import com.prism.query.sql.RenderOptions;
import com.prism.query.sql.Select;
import com.prism.query.sql.SqlClause;
import com.prism.query.sql.SqlCompiler;
import com.prism.query.sql.TableRef;
import com.prism.query.sql.TextClause;
import com.prism.query.sql.TextSource;
import com.prism.template.TemplateContext;
import com.prism.template.TemplateProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Compiles a {@link QueryObject} against a {@link SqlTable} into one SQL statement.
 *
 * The outer query projects the groupby columns, the time axis and the
 * metrics. When a time series asks for a series limit, the source is joined
 * with an inner query that ranks the groupby combinations by a metric over
 * the inner time range and keeps the top N. Every value is inlined as a
 * literal.
 *
 * Compilation is pure: no shared state is touched besides logging and
 * metrics, so one instance serves concurrent callers.
 */
@Component
public class SqlQueryCompiler {

    private static final Logger logger = LoggerFactory.getLogger(SqlQueryCompiler.class);

    public static final String INNER_METRIC_ALIAS = "mme_inner__";
    public static final String INNER_GROUPBY_SUFFIX = "__";
    public static final String INNER_QUERY_ALIAS = "inner_qry";
    public static final String DERIVED_TABLE_ALIAS = "expr_qry";
    public static final String FALLBACK_METRIC_ALIAS = "ccount";

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private final ColumnExpressionResolver columnResolver;
    private final MetricExpressionResolver metricResolver;
    private final TimeFilterBuilder timeFilterBuilder;
    private final TemplateProcessor templateProcessor;
    private final QueryMetrics metrics;

    public SqlQueryCompiler(ColumnExpressionResolver columnResolver,
                            MetricExpressionResolver metricResolver,
                            TimeFilterBuilder timeFilterBuilder,
                            TemplateProcessor templateProcessor,
                            QueryMetrics metrics) {
        this.columnResolver = columnResolver;
        this.metricResolver = metricResolver;
        this.timeFilterBuilder = timeFilterBuilder;
        this.templateProcessor = templateProcessor;
        this.metrics = metrics;
    }

    public CompiledQuery compile(SqlTable table, QueryObject query) {
        try {
            CompiledQuery compiled = doCompile(table, query);
            metrics.recordQueryCompiled();
            return compiled;
        } catch (QueryCompilationException e) {
            metrics.recordCompilationError();
            logger.warn("Query on {} rejected: {}", table.getName(), e.getMessage());
            throw e;
        }
    }

    private CompiledQuery doCompile(SqlTable table, QueryObject query) {
        BaseEngineSpec engineSpec = table.getDatabase().getEngineSpec();
        TemplateContext templateContext = new TemplateContext(table, query.getFromDttm(), query.getToDttm(),
                query.getRowLimit(), query.getGroupby(), query.getMetrics());

        // Unknown granularity falls back to the main time column
        String granularity = query.getGranularity();
        if (!table.getDttmCols().contains(granularity)) {
            if (granularity != null) {
                logger.debug("Granularity '{}' is not a time column of {}, using main time column '{}'",
                        granularity, table.getName(), table.getMainDttmCol());
            }
            granularity = table.getMainDttmCol();
        }
        if (granularity == null && query.isTimeseries()) {
            throw new DatasourceConfigurationException(
                    "Datetime column not provided as part table configuration "
                            + "and is required by this type of chart", table.getName());
        }

        List<Label> metricExprs = new ArrayList<>();
        for (String metricName : query.getMetrics()) {
            metricExprs.add(metricResolver.resolve(table, metricName));
        }
        Label seriesLimitMetricExpr = null;
        if (query.getTimeseriesLimitMetric() != null && !query.getTimeseriesLimitMetric().isEmpty()) {
            seriesLimitMetricExpr = metricResolver.resolve(table, query.getTimeseriesLimitMetric());
        }
        Label mainMetricExpr = !metricExprs.isEmpty()
                ? metricExprs.get(0)
                : ColumnClause.literalColumn("COUNT(*)").label(FALLBACK_METRIC_ALIAS);

        List<String> groupby = query.getGroupby();
        boolean flatColumns = groupby.isEmpty() && !query.getColumns().isEmpty();

        List<SqlClause> selectExprs = new ArrayList<>();
        List<SqlClause> groupbyExprs = new ArrayList<>();
        List<SqlClause> innerSelectExprs = new ArrayList<>();
        List<SqlClause> innerGroupbyExprs = new ArrayList<>();

        if (!groupby.isEmpty()) {
            for (String name : groupby) {
                Label outer = columnResolver.resolve(table, name);
                Label inner = outer.relabel(name + INNER_GROUPBY_SUFFIX);
                selectExprs.add(outer);
                groupbyExprs.add(outer);
                innerSelectExprs.add(inner);
                innerGroupbyExprs.add(inner);
            }
        } else if (flatColumns) {
            for (String name : query.getColumns()) {
                selectExprs.add(columnResolver.resolve(table, name));
            }
            metricExprs = new ArrayList<>();
        }

        TableColumn dttmCol = null;
        BooleanClauseList timeFilter = null;
        if (granularity != null) {
            dttmCol = table.getColumn(granularity);
            if (dttmCol == null) {
                throw new DatasourceConfigurationException(
                        "Time column '" + granularity + "' is not defined on " + table.getName(), table.getName());
            }
            if (query.isTimeseries()) {
                Label timestamp = columnResolver.timestampExpression(dttmCol, query.getTimeGrain(), engineSpec);
                selectExprs.add(timestamp);
                groupbyExprs.add(timestamp);
            }
            timeFilter = timeFilterBuilder.build(dttmCol, query.getTimeRange(), engineSpec);
        }

        selectExprs.addAll(metricExprs);
        Select select = new Select(selectExprs);

        FromClause source = buildSource(table, templateContext);

        if (!flatColumns) {
            select.groupBy(groupbyExprs);
        }

        List<SqlClause> whereClauses = buildFilterClauses(table, query.getFilter());
        if (query.getWhere() != null && !query.getWhere().isEmpty()) {
            whereClauses.add(new Grouping(new TextClause(templateProcessor.process(query.getWhere(), templateContext))));
        }
        if (timeFilter != null && !timeFilter.isEmpty()) {
            select.where(timeFilter);
        }
        whereClauses.forEach(select::where);
        if (query.getHaving() != null && !query.getHaving().isEmpty()) {
            select.having(new Grouping(new TextClause(templateProcessor.process(query.getHaving(), templateContext))));
        }

        if (!groupby.isEmpty()) {
            select.orderBy(OrderByItem.desc(mainMetricExpr));
        } else {
            for (SortField sortField : query.getOrderby()) {
                select.orderBy(new OrderByItem(ColumnClause.column(sortField.getColumn()), sortField.isAscending()));
            }
        }

        select.limit(query.getRowLimit());

        Integer seriesLimit = query.getTimeseriesLimit();
        if (query.isTimeseries() && seriesLimit != null && seriesLimit > 0 && !groupby.isEmpty()) {
            Label innerMainMetricExpr = mainMetricExpr.relabel(INNER_METRIC_ALIAS);
            innerSelectExprs.add(innerMainMetricExpr);
            Select subquery = new Select(innerSelectExprs).from(source);
            whereClauses.forEach(subquery::where);
            BooleanClauseList innerTimeFilter =
                    timeFilterBuilder.build(dttmCol, query.getInnerTimeRange(), engineSpec);
            if (!innerTimeFilter.isEmpty()) {
                subquery.where(innerTimeFilter);
            }
            subquery.groupBy(innerGroupbyExprs);
            subquery.orderBy(OrderByItem.desc(seriesLimitMetricExpr != null ? seriesLimitMetricExpr : innerMainMetricExpr));
            subquery.limit(seriesLimit);

            List<SqlClause> onClause = new ArrayList<>();
            for (int i = 0; i < groupby.size(); i++) {
                onClause.add(BinaryClause.eq(groupbyExprs.get(i), ColumnClause.column(groupby.get(i) + INNER_GROUPBY_SUFFIX)));
            }
            source = new Join(source, subquery, INNER_QUERY_ALIAS, new BooleanClauseList(onClause));
        }

        select.from(source);

        RenderOptions options = RenderOptions.compact().withUnescapeDateTimePercent(granularity != null);
        return render(select, engineSpec, options);
    }

    /**
     * {@code SELECT DISTINCT col} over the table source, restricted to the
     * main time column's range when the table has one
     */
    public CompiledQuery compileColumnValues(SqlTable table, String columnName,
                                             LocalDateTime fromDttm, LocalDateTime toDttm, int limit) {
        BaseEngineSpec engineSpec = table.getDatabase().getEngineSpec();
        Label target = columnResolver.resolve(table, columnName);
        TemplateContext templateContext = new TemplateContext(table, fromDttm, toDttm, limit, List.of(), List.of());

        Select select = new Select(List.of(target))
                .distinct()
                .from(buildSource(table, templateContext))
                .limit(limit);

        TableColumn dttmCol = table.getColumn(table.getMainDttmCol());
        if (dttmCol != null) {
            BooleanClauseList timeFilter = timeFilterBuilder.build(dttmCol, new TimeRange(fromDttm, toDttm), engineSpec);
            if (!timeFilter.isEmpty()) {
                select.where(timeFilter);
            }
        }
        return render(select, engineSpec, RenderOptions.compact());
    }

    private CompiledQuery render(Select select, BaseEngineSpec engineSpec, RenderOptions options) {
        String compact = new SqlCompiler(engineSpec, options).compile(select);
        logger.info(compact);
        String pretty = new SqlCompiler(engineSpec, options.withPretty(true)).compile(select);
        String formatStyle = engineSpec.escapesPercent()
                ? new SqlCompiler(engineSpec, options.withFormatStyleParams(true)).compile(select)
                : compact;
        return new CompiledQuery(pretty, compact, formatStyle, engineSpec.getEngine());
    }

    private FromClause buildSource(SqlTable table, TemplateContext templateContext) {
        if (table.hasSql()) {
            return new TextSource(templateProcessor.process(table.getSql(), templateContext), DERIVED_TABLE_ALIAS);
        }
        return new TableRef(table.getSchema(), table.getTableName());
    }

    private List<SqlClause> buildFilterClauses(SqlTable table, List<QueryFilter> filters) {
        List<SqlClause> clauses = new ArrayList<>();
        for (QueryFilter filter : filters) {
            if (!filter.isComplete()) {
                logger.debug("Skipping incomplete filter {}", filter);
                continue;
            }
            String op = filter.getOp().trim().toLowerCase(Locale.ROOT);
            if (!QueryFilter.IN.equals(op) && !QueryFilter.NOT_IN.equals(op)) {
                logger.debug("Ignoring filter with unsupported operator {}", filter);
                continue;
            }
            TableColumn column = columnResolver.requireColumn(table, filter.getCol());
            List<Object> values = new ArrayList<>();
            for (String raw : filter.getVal()) {
                if (raw == null) {
                    values.add(null);
                    continue;
                }
                String value = strip(strip(raw, '\''), '"');
                values.add(column.isNum() ? toNumber(value, column, table) : value);
            }
            InClause in = new InClause(columnResolver.resolve(column), values, false);
            clauses.add(QueryFilter.NOT_IN.equals(op) ? in.negate() : in);
        }
        return clauses;
    }

    private static String strip(String value, char c) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == c) {
            start++;
        }
        while (end > start && value.charAt(end - 1) == c) {
            end--;
        }
        return value.substring(start, end);
    }

    private static Object toNumber(String value, TableColumn column, SqlTable table) {
        String trimmed = value.trim();
        try {
            if (INTEGER.matcher(trimmed).matches()) {
                BigDecimal integral = new BigDecimal(trimmed);
                return integral.toBigInteger().bitLength() < 64 ? (Object) integral.longValue() : integral;
            }
            return new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            throw new QueryValidationException(
                    "Value '" + value + "' is not a valid number for column '" + column.getColumnName() + "'",
                    table.getName(), value, e);
        }
    }
}
