package com.prism.query;

import com.prism.domain.QueryResult;
import com.prism.domain.SqlTable;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * QueryExecutor compiles query descriptions and runs the resulting SQL.
 *
 * Execution failures never escape {@link #query}: they are reported through
 * a {@link QueryResult} with status FAILED. Compilation errors are raised
 * before anything is sent to the database.
 *
 * Connections belong to the caller. The configured {@link JdbcTemplate} is
 * used unless another {@link JdbcOperations} is passed in. No retries,
 * timeouts or caching are applied here.
 */
@Service
public class QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final SqlQueryCompiler compiler;
    private final JdbcOperations jdbcOperations;
    private final QueryMetrics metrics;
    private final int defaultRowLimit;
    private final int valuesLimit;

    /**
     * @param compiler SQL compiler for query descriptions
     * @param jdbcTemplate default connection handle
     * @param metrics metrics collector for query execution
     * @param defaultRowLimit row limit applied when a query asks for none, 0 for no limit
     * @param valuesLimit default number of distinct values sampled per column
     */
    public QueryExecutor(
            SqlQueryCompiler compiler,
            @Qualifier("prismJdbcTemplate") JdbcTemplate jdbcTemplate,
            QueryMetrics metrics,
            @Value("${prism.query.default-row-limit:0}") int defaultRowLimit,
            @Value("${prism.query.values-limit:500}") int valuesLimit) {
        this.compiler = compiler;
        this.jdbcOperations = jdbcTemplate;
        this.metrics = metrics;
        this.defaultRowLimit = defaultRowLimit;
        this.valuesLimit = valuesLimit;

        log.info("QueryExecutor initialized (defaultRowLimit={}, valuesLimit={})", defaultRowLimit, valuesLimit);
    }

    public QueryResult query(SqlTable table, QueryObject queryObject) {
        return query(table, queryObject, jdbcOperations);
    }

    /**
     * Compile and run one query against the given connection handle.
     * Duration is measured from just before compilation.
     */
    public QueryResult query(SqlTable table, QueryObject queryObject, JdbcOperations connection) {
        Instant start = Instant.now();
        CompiledQuery compiled = compiler.compile(table, withDefaultRowLimit(queryObject));
        String sql = compiled.getSql();

        Timer.Sample sample = metrics.startQueryTimer();
        try {
            List<Map<String, Object>> rows = connection.queryForList(sql);
            metrics.recordQueryExecuted();
            metrics.recordResultSize(rows.size());
            Duration duration = Duration.between(start, Instant.now());
            log.debug("Query on {} returned {} rows in {}ms", table.getName(), rows.size(), duration.toMillis());
            return QueryResult.success(rows, duration, sql);
        } catch (RuntimeException e) {
            metrics.recordQueryFailed();
            log.error("Query on {} failed: {}", table.getName(), e.getMessage(), e);
            return QueryResult.failure(e.getMessage(), Duration.between(start, Instant.now()), sql);
        } finally {
            metrics.recordQueryLatency(sample);
        }
    }

    /**
     * Runs {@link #query(SqlTable, QueryObject)} on the bounded elastic scheduler
     */
    public Mono<QueryResult> queryAsync(SqlTable table, QueryObject queryObject) {
        return Mono.fromCallable(() -> query(table, queryObject))
            .subscribeOn(Schedulers.boundedElastic());
    }

    public List<Object> valuesForColumn(SqlTable table, String columnName,
                                        LocalDateTime fromDttm, LocalDateTime toDttm) {
        return valuesForColumn(table, columnName, fromDttm, toDttm, valuesLimit);
    }

    /**
     * Sample distinct values of a column within the main time range.
     *
     * @throws QueryExecutionException if the database rejects the statement
     */
    public List<Object> valuesForColumn(SqlTable table, String columnName,
                                        LocalDateTime fromDttm, LocalDateTime toDttm, int limit) {
        CompiledQuery compiled = compiler.compileColumnValues(table, columnName, fromDttm, toDttm, limit);
        try {
            List<Map<String, Object>> rows = jdbcOperations.queryForList(compiled.getSql());
            List<Object> values = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                values.add(row.values().iterator().next());
            }
            return values;
        } catch (DataAccessException e) {
            throw new QueryExecutionException(
                "Failed to fetch values for column " + columnName, table.getName(), compiled.getCompactSql(), e);
        }
    }

    private QueryObject withDefaultRowLimit(QueryObject queryObject) {
        if (queryObject.getRowLimit() != null || defaultRowLimit <= 0) {
            return queryObject;
        }
        QueryObject limited = new QueryObject(queryObject);
        limited.setRowLimit(defaultRowLimit);
        return limited;
    }
}
