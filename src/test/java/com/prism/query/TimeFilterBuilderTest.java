package com.prism.query;

import com.prism.dialect.BaseEngineSpec;
import com.prism.dialect.H2EngineSpec;
import com.prism.dialect.MySqlEngineSpec;
import com.prism.dialect.PrestoEngineSpec;
import com.prism.dialect.SqliteEngineSpec;
import com.prism.domain.TableColumn;
import com.prism.query.sql.BooleanClauseList;
import com.prism.query.sql.RenderOptions;
import com.prism.query.sql.Select;
import com.prism.query.sql.SqlCompiler;
import com.prism.query.sql.TextClause;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for TimeFilterBuilder literal rendering
 */
@DisplayName("TimeFilterBuilder Tests")
class TimeFilterBuilderTest {

    private static final LocalDateTime NEW_YEAR = LocalDateTime.of(2020, 1, 1, 0, 0);

    private TimeFilterBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new TimeFilterBuilder(new ColumnExpressionResolver());
    }

    @Test
    void testDatabaseExpressionTakesPrecedence() {
        // Given: A column with a conversion template and an epoch hint
        TableColumn column = new TableColumn("ts", "TIMESTAMP");
        column.setDatabaseExpression("TO_TIMESTAMP('{}', 'YYYY-MM-DD HH24:MI:SS')");
        column.setDateFormat(TableColumn.EPOCH_S);

        // When/Then: The template wins
        assertThat(builder.toSqlLiteral(column, NEW_YEAR.plusHours(13).plusMinutes(5), new MySqlEngineSpec()))
                .isEqualTo("TO_TIMESTAMP('2020-01-01 13:05:00', 'YYYY-MM-DD HH24:MI:SS')");
    }

    @Test
    void testEpochSeconds() {
        TableColumn column = new TableColumn("created", "BIGINT");
        column.setDateFormat(TableColumn.EPOCH_S);

        assertThat(builder.toSqlLiteral(column, NEW_YEAR, new BaseEngineSpec())).isEqualTo("1577836800.0");
        assertThat(builder.toSqlLiteral(column, NEW_YEAR.plusNanos(500_000_000), new BaseEngineSpec()))
                .isEqualTo("1577836800.5");
    }

    @Test
    void testEpochMilliseconds() {
        TableColumn column = new TableColumn("created", "BIGINT");
        column.setDateFormat(TableColumn.EPOCH_MS);

        assertThat(builder.toSqlLiteral(column, NEW_YEAR, new BaseEngineSpec())).isEqualTo("1577836800000.0");
        assertThat(builder.toSqlLiteral(column, NEW_YEAR.plusNanos(1_500_000), new BaseEngineSpec()))
                .isEqualTo("1577836800001.5");
    }

    @Test
    void testEpochMillisecondsIsThousandTimesSeconds() {
        TableColumn seconds = new TableColumn("created", "BIGINT");
        seconds.setDateFormat(TableColumn.EPOCH_S);
        TableColumn millis = new TableColumn("created", "BIGINT");
        millis.setDateFormat(TableColumn.EPOCH_MS);

        for (LocalDateTime instant : List.of(NEW_YEAR, LocalDateTime.of(1999, 12, 31, 23, 59, 59, 250_000_000))) {
            double s = Double.parseDouble(builder.toSqlLiteral(seconds, instant, new BaseEngineSpec()));
            double ms = Double.parseDouble(builder.toSqlLiteral(millis, instant, new BaseEngineSpec()));
            assertThat(ms).isEqualTo(s * 1000.0);
        }
    }

    @Test
    void testEngineConversion() {
        TableColumn datetime = new TableColumn("ts", "DATETIME");
        TableColumn timestamp = new TableColumn("ts", "TIMESTAMP");
        TableColumn date = new TableColumn("d", "DATE");

        assertThat(builder.toSqlLiteral(datetime, NEW_YEAR, new MySqlEngineSpec()))
                .isEqualTo("STR_TO_DATE('2020-01-01 00:00:00', '%Y-%m-%d %H:%i:%s')");
        assertThat(builder.toSqlLiteral(timestamp, NEW_YEAR, new PrestoEngineSpec()))
                .isEqualTo("from_iso8601_timestamp('2020-01-01T00:00:00')");
        assertThat(builder.toSqlLiteral(date, NEW_YEAR, new PrestoEngineSpec()))
                .isEqualTo("from_iso8601_date('2020-01-01')");
        assertThat(builder.toSqlLiteral(timestamp, NEW_YEAR, new H2EngineSpec()))
                .isEqualTo("TIMESTAMP '2020-01-01 00:00:00'");
    }

    @Test
    void testFallbackToFormattedString() {
        // Given: Engines without a conversion for the column type
        TableColumn defaultFormat = new TableColumn("ts", "TIMESTAMP");
        TableColumn customFormat = new TableColumn("day", "VARCHAR");
        customFormat.setDateFormat("yyyy/MM/dd");

        // When/Then: The column's date format is used, microseconds by default
        assertThat(builder.toSqlLiteral(defaultFormat, NEW_YEAR.plusNanos(123_456_000), new SqliteEngineSpec()))
                .isEqualTo("'2020-01-01 00:00:00.123456'");
        assertThat(builder.toSqlLiteral(customFormat, NEW_YEAR, new H2EngineSpec()))
                .isEqualTo("'2020/01/01'");
    }

    @Test
    void testInvalidDateFormatIsConfigurationError() {
        TableColumn column = new TableColumn("day", "VARCHAR");
        column.setDateFormat("%Y-%m-%d {");

        assertThatThrownBy(() -> builder.toSqlLiteral(column, NEW_YEAR, new BaseEngineSpec()))
                .isInstanceOf(DatasourceConfigurationException.class)
                .hasMessageContaining("day");
    }

    @Test
    void testRangePredicates() {
        // Given: A derived time column
        TableColumn column = new TableColumn("event_time", "TIMESTAMP");
        column.setExpression("CAST(raw_time AS TIMESTAMP)");

        // When: Building a closed and a half-open range
        BooleanClauseList closed = builder.build(column, new TimeRange(NEW_YEAR, NEW_YEAR.plusDays(1)), new H2EngineSpec());
        BooleanClauseList open = builder.build(column, new TimeRange(null, NEW_YEAR), new H2EngineSpec());
        BooleanClauseList none = builder.build(column, new TimeRange(null, null), new H2EngineSpec());

        // Then: Inclusive bounds on the column expression
        assertThat(where(closed, new H2EngineSpec())).isEqualTo(
                "SELECT 1 WHERE CAST(raw_time AS TIMESTAMP) >= TIMESTAMP '2020-01-01 00:00:00' "
                        + "AND CAST(raw_time AS TIMESTAMP) <= TIMESTAMP '2020-01-02 00:00:00'");
        assertThat(where(open, new H2EngineSpec())).isEqualTo(
                "SELECT 1 WHERE CAST(raw_time AS TIMESTAMP) <= TIMESTAMP '2020-01-01 00:00:00'");
        assertThat(none.isEmpty()).isTrue();
    }

    private static String where(BooleanClauseList filter, BaseEngineSpec engineSpec) {
        Select select = new Select(List.of(new TextClause("1"))).where(filter);
        return new SqlCompiler(engineSpec, RenderOptions.compact()).compile(select);
    }
}
