package com.prism.query;

import com.prism.domain.SqlMetric;
import com.prism.domain.SqlTable;
import com.prism.query.sql.ColumnClause;
import com.prism.query.sql.Label;
import org.springframework.stereotype.Component;

/**
 * Maps metrics to their aggregate expression, aliased by metric name
 */
@Component
public class MetricExpressionResolver {

    public Label resolve(SqlMetric metric) {
        return ColumnClause.literalColumn(metric.getExpression()).label(metric.getMetricName());
    }

    public Label resolve(SqlTable table, String metricName) {
        SqlMetric metric = table.getMetric(metricName);
        if (metric == null) {
            throw new QueryValidationException(
                    "Metric '" + metricName + "' is not valid", table.getName(), metricName);
        }
        return resolve(metric);
    }
}
