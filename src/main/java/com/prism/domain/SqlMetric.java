package com.prism.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named aggregate expression defined on a {@link SqlTable}
 */
public class SqlMetric {

    @JsonProperty("metric_name")
    private String metricName;

    @JsonProperty("verbose_name")
    private String verboseName;

    @JsonProperty("metric_type")
    private String metricType;

    @JsonProperty("expression")
    private String expression;

    public SqlMetric() {
    }

    public SqlMetric(String metricName, String expression) {
        this.metricName = metricName;
        this.expression = expression;
    }

    public SqlMetric(String metricName, String verboseName, String expression) {
        this.metricName = metricName;
        this.verboseName = verboseName;
        this.expression = expression;
    }

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public String getVerboseName() {
        return verboseName;
    }

    public void setVerboseName(String verboseName) {
        this.verboseName = verboseName;
    }

    public String getMetricType() {
        return metricType;
    }

    public void setMetricType(String metricType) {
        this.metricType = metricType;
    }

    public String getExpression() {
        return expression;
    }

    public void setExpression(String expression) {
        this.expression = expression;
    }

    @Override
    public String toString() {
        return metricName;
    }
}
