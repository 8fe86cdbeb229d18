package com.prism.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for reading query descriptions from JSON
 */
class QueryObjectTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void testReadQueryDescription() throws Exception {
        // Given: A query description in JSON with snake_case names
        String json = "{"
                + "\"granularity\": \"ts\","
                + "\"from_dttm\": \"2020-01-01T00:00:00\","
                + "\"to_dttm\": \"2020-01-02T00:00:00\","
                + "\"inner_from_dttm\": \"2019-12-01T00:00:00\","
                + "\"is_timeseries\": true,"
                + "\"groupby\": [\"country\"],"
                + "\"metrics\": [\"count\", \"sum_num\"],"
                + "\"filter\": [{\"col\": \"country\", \"op\": \"not in\", \"val\": [\"US\", \"FR\"]}],"
                + "\"where\": \"num > 0\","
                + "\"having\": \"SUM(num) > 10\","
                + "\"time_grain_sqla\": \"day\","
                + "\"row_limit\": 100,"
                + "\"timeseries_limit\": 5,"
                + "\"timeseries_limit_metric\": \"sum_num\","
                + "\"orderby\": [{\"column\": \"num\", \"ascending\": false}],"
                + "\"extras\": {\"ignored\": true}"
                + "}";

        // When: Reading it
        QueryObject query = objectMapper.readValue(json, QueryObject.class);

        // Then: Every field is populated
        assertThat(query.getGranularity()).isEqualTo("ts");
        assertThat(query.getFromDttm()).isEqualTo(LocalDateTime.of(2020, 1, 1, 0, 0));
        assertThat(query.getToDttm()).isEqualTo(LocalDateTime.of(2020, 1, 2, 0, 0));
        assertThat(query.isTimeseries()).isTrue();
        assertThat(query.getGroupby()).containsExactly("country");
        assertThat(query.getMetrics()).containsExactly("count", "sum_num");
        assertThat(query.getFilter()).hasSize(1);
        assertThat(query.getFilter().get(0).getOp()).isEqualTo(QueryFilter.NOT_IN);
        assertThat(query.getFilter().get(0).getVal()).containsExactly("US", "FR");
        assertThat(query.getWhere()).isEqualTo("num > 0");
        assertThat(query.getHaving()).isEqualTo("SUM(num) > 10");
        assertThat(query.getTimeGrain()).isEqualTo("day");
        assertThat(query.getRowLimit()).isEqualTo(100);
        assertThat(query.getTimeseriesLimit()).isEqualTo(5);
        assertThat(query.getTimeseriesLimitMetric()).isEqualTo("sum_num");
        assertThat(query.getOrderby()).hasSize(1);
        assertThat(query.getOrderby().get(0).getColumn()).isEqualTo("num");
        assertThat(query.getOrderby().get(0).isAscending()).isFalse();
    }

    @Test
    void testInnerTimeRangeFallsBackToOuterBounds() {
        QueryObject query = new QueryObject();
        query.setFromDttm(LocalDateTime.of(2020, 1, 1, 0, 0));
        query.setToDttm(LocalDateTime.of(2020, 1, 2, 0, 0));
        query.setInnerFromDttm(LocalDateTime.of(2019, 12, 1, 0, 0));

        TimeRange inner = query.getInnerTimeRange();

        assertThat(inner.getFrom()).isEqualTo(LocalDateTime.of(2019, 12, 1, 0, 0));
        assertThat(inner.getTo()).isEqualTo(LocalDateTime.of(2020, 1, 2, 0, 0));
    }

    @Test
    void testDefaults() throws Exception {
        QueryObject query = objectMapper.readValue("{}", QueryObject.class);

        assertThat(query.isTimeseries()).isTrue();
        assertThat(query.getGroupby()).isEmpty();
        assertThat(query.getMetrics()).isEmpty();
        assertThat(query.getFilter()).isEmpty();
        assertThat(query.getRowLimit()).isNull();
        assertThat(query.getTimeseriesLimit()).isNull();
        assertThat(query.getTimeRange().isUnbounded()).isTrue();
    }

    @Test
    void testCopyIsIndependent() {
        QueryObject original = new QueryObject();
        original.setGroupby(new java.util.ArrayList<>(java.util.List.of("country")));
        original.setRowLimit(5);

        QueryObject copy = new QueryObject(original);
        copy.getGroupby().add("num");
        copy.setRowLimit(10);

        assertThat(original.getGroupby()).containsExactly("country");
        assertThat(original.getRowLimit()).isEqualTo(5);
        assertThat(copy.getGroupby()).containsExactly("country", "num");
    }
}
