package com.prism.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for query compilation and execution
 * Tracks compiled statements, compilation errors, executions, failures,
 * execution latency and result sizes
 */
@Component
public class QueryMetrics {

    @Autowired
    MeterRegistry meterRegistry;

    private Counter queriesCompiled;
    private Counter compilationErrors;
    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Timer queryExecutionLatency;
    private DistributionSummary resultSize;

    @PostConstruct
    public void init() {
        queriesCompiled = Counter.builder("prism.query.compiled")
            .description("Total number of queries compiled to SQL")
            .register(meterRegistry);

        compilationErrors = Counter.builder("prism.query.compilation.errors")
            .description("Total number of query descriptions rejected during compilation")
            .register(meterRegistry);

        queriesExecuted = Counter.builder("prism.query.executed")
            .description("Total number of queries executed successfully")
            .register(meterRegistry);

        queriesFailed = Counter.builder("prism.query.failed")
            .description("Total number of queries that failed during execution")
            .register(meterRegistry);

        // Timer with histogram support for percentile calculation
        queryExecutionLatency = Timer.builder("prism.query.execution.latency")
            .description("Latency of query execution against the database")
            .publishPercentiles(0.5, 0.95, 0.99) // P50, P95, P99
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(60))
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("prism.query.result.size")
            .description("Distribution of query result sizes (number of rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    public void recordQueryCompiled() {
        queriesCompiled.increment();
    }

    public void recordCompilationError() {
        compilationErrors.increment();
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryExecutionLatency);
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    // Getter methods for testing
    public Counter getQueriesCompiled() {
        return queriesCompiled;
    }

    public Counter getCompilationErrors() {
        return compilationErrors;
    }

    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Timer getQueryExecutionLatency() {
        return queryExecutionLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }
}
