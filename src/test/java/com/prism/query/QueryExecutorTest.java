package com.prism.query;

import com.prism.dialect.BaseEngineSpec;
import com.prism.domain.Database;
import com.prism.domain.QueryResult;
import com.prism.domain.QueryStatus;
import com.prism.domain.SqlMetric;
import com.prism.domain.SqlTable;
import com.prism.domain.TableColumn;
import com.prism.template.PlaceholderTemplateProcessor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import reactor.test.StepVerifier;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for QueryExecutor with a mocked connection
 */
@ExtendWith(MockitoExtension.class)
class QueryExecutorTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private JdbcOperations otherConnection;

    private QueryMetrics metrics;
    private SqlQueryCompiler compiler;
    private QueryExecutor queryExecutor;
    private SqlTable table;

    @BeforeEach
    void setUp() {
        metrics = new QueryMetrics();
        metrics.meterRegistry = new SimpleMeterRegistry();
        metrics.init();
        ColumnExpressionResolver columnResolver = new ColumnExpressionResolver();
        compiler = new SqlQueryCompiler(columnResolver, new MetricExpressionResolver(),
                new TimeFilterBuilder(columnResolver), new PlaceholderTemplateProcessor(), metrics);
        queryExecutor = new QueryExecutor(compiler, jdbcTemplate, metrics, 0, 500);

        table = new SqlTable("events", new Database("warehouse", new BaseEngineSpec()))
                .addColumn(new TableColumn("kind", "VARCHAR"))
                .addMetric(new SqlMetric("cnt", "COUNT(*)"));
    }

    private static QueryObject countByKind() {
        QueryObject query = new QueryObject();
        query.setTimeseries(false);
        query.setGroupby(List.of("kind"));
        query.setMetrics(List.of("cnt"));
        return query;
    }

    @Test
    void testSuccessfulQuery_ShouldReturnRowsAndSql() {
        // Given: The connection returns two rows
        List<Map<String, Object>> rows = List.of(
                Map.of("kind", "login", "cnt", 3L),
                Map.of("kind", "logout", "cnt", 1L));
        when(jdbcTemplate.queryForList(anyString())).thenReturn(rows);

        // When: Running the query
        QueryResult result = queryExecutor.query(table, countByKind());

        // Then: Rows, SQL and timing are reported
        assertThat(result.getStatus()).isEqualTo(QueryStatus.SUCCESS);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRows()).isEqualTo(rows);
        assertThat(result.getRowCount()).isEqualTo(2);
        assertThat(result.getErrorMessage()).isNull();
        assertThat(result.getDuration()).isNotNull();
        assertThat(result.getQuery()).isEqualTo(
                "SELECT kind AS kind,\n       COUNT(*) AS cnt\nFROM events\nGROUP BY kind\nORDER BY cnt DESC");
        verify(jdbcTemplate).queryForList(result.getQuery());
        assertThat(metrics.getQueriesExecuted().count()).isEqualTo(1.0);
        assertThat(metrics.getResultSize().totalAmount()).isEqualTo(2.0);
        assertThat(metrics.getQueryExecutionLatency().count()).isEqualTo(1);
    }

    @Test
    void testFailedQuery_ShouldReturnFailedResult() {
        // Given: The connection throws
        when(jdbcTemplate.queryForList(anyString()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When: Running the query
        QueryResult result = queryExecutor.query(table, countByKind());

        // Then: The error is captured, not thrown
        assertThat(result.getStatus()).isEqualTo(QueryStatus.FAILED);
        assertThat(result.getRows()).isNull();
        assertThat(result.getRowCount()).isZero();
        assertThat(result.getErrorMessage()).isEqualTo("connection refused");
        assertThat(result.getQuery()).startsWith("SELECT kind AS kind");
        assertThat(result.getDuration()).isNotNull();
        assertThat(metrics.getQueriesFailed().count()).isEqualTo(1.0);
        assertThat(metrics.getQueriesExecuted().count()).isZero();
    }

    @Test
    void testCompilationError_ShouldPropagateWithoutExecuting() {
        // Given: An unknown metric
        QueryObject query = countByKind();
        query.setMetrics(List.of("bogus"));

        // When/Then: The validation error escapes and nothing runs
        assertThatThrownBy(() -> queryExecutor.query(table, query))
                .isInstanceOf(QueryValidationException.class);
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void testCallerSuppliedConnection_ShouldBeUsed() {
        when(otherConnection.queryForList(anyString())).thenReturn(List.of());

        QueryResult result = queryExecutor.query(table, countByKind(), otherConnection);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRows()).isEmpty();
        verify(jdbcTemplate, never()).queryForList(anyString());
    }

    @Test
    void testDefaultRowLimit_ShouldApplyOnlyWhenQueryHasNone() {
        // Given: An executor with a default row limit
        QueryExecutor limited = new QueryExecutor(compiler, jdbcTemplate, metrics, 1000, 500);
        when(jdbcTemplate.queryForList(anyString())).thenReturn(List.of());
        QueryObject explicit = countByKind();
        explicit.setRowLimit(10);
        QueryObject unlimited = countByKind();

        // When: Running both
        String withDefault = limited.query(table, unlimited).getQuery();
        String withExplicit = limited.query(table, explicit).getQuery();

        // Then: The default only fills in a missing limit, without touching the caller's object
        assertThat(withDefault).endsWith("LIMIT 1000");
        assertThat(withExplicit).endsWith("LIMIT 10");
        assertThat(unlimited.getRowLimit()).isNull();
    }

    @Test
    void testQueryAsync_ShouldEmitResult() {
        when(jdbcTemplate.queryForList(anyString())).thenReturn(List.of(Map.of("kind", "login", "cnt", 1L)));

        StepVerifier.create(queryExecutor.queryAsync(table, countByKind()))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isTrue();
                    assertThat(result.getRowCount()).isEqualTo(1);
                })
                .verifyComplete();
    }

    @Test
    void testQueryAsync_ShouldSignalCompilationError() {
        QueryObject query = countByKind();
        query.setGroupby(List.of("nope"));

        StepVerifier.create(queryExecutor.queryAsync(table, query))
                .expectError(QueryValidationException.class)
                .verify();
    }

    @Test
    void testValuesForColumn_ShouldReturnFirstColumn() {
        when(jdbcTemplate.queryForList(anyString())).thenReturn(List.of(
                Map.of("kind", "login"),
                Map.of("kind", "logout")));

        List<Object> values = queryExecutor.valuesForColumn(table, "kind",
                LocalDateTime.of(2020, 1, 1, 0, 0), LocalDateTime.of(2020, 1, 2, 0, 0));

        assertThat(values).containsExactly("login", "logout");
        verify(jdbcTemplate).queryForList("SELECT DISTINCT kind AS kind\nFROM events\nLIMIT 500");
    }

    @Test
    void testValuesForColumn_ShouldWrapDatabaseErrors() {
        when(jdbcTemplate.queryForList(anyString())).thenThrow(
                new BadSqlGrammarException("values", "SELECT DISTINCT kind", new SQLException("no such table")));

        assertThatThrownBy(() -> queryExecutor.valuesForColumn(table, "kind", null, null, 5))
                .isInstanceOf(QueryExecutionException.class)
                .hasMessageContaining("Failed to fetch values for column kind")
                .hasMessageContaining("[Datasource: events]")
                .hasMessageContaining("[Query: SELECT DISTINCT kind AS kind FROM events LIMIT 5]")
                .hasCauseInstanceOf(BadSqlGrammarException.class);
    }
}
