package com.prism.dialect;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL
 */
public class PostgresEngineSpec extends BaseEngineSpec {

    @Override
    public String getEngine() {
        return "postgresql";
    }

    @Override
    public boolean escapesPercent() {
        return true;
    }

    @Override
    protected List<TimeGrain> timeGrains() {
        return List.of(
                TIME_COLUMN,
                new TimeGrain("second", "second", "DATE_TRUNC('second', {col})"),
                new TimeGrain("minute", "minute", "DATE_TRUNC('minute', {col})"),
                new TimeGrain("hour", "hour", "DATE_TRUNC('hour', {col})"),
                new TimeGrain("day", "day", "DATE_TRUNC('day', {col})"),
                new TimeGrain("week", "week", "DATE_TRUNC('week', {col})"),
                new TimeGrain("month", "month", "DATE_TRUNC('month', {col})"),
                new TimeGrain("quarter", "quarter", "DATE_TRUNC('quarter', {col})"),
                new TimeGrain("year", "year", "DATE_TRUNC('year', {col})"));
    }

    @Override
    public String epochToDttm() {
        return "(timestamp 'epoch' + {col} * interval '1 second')";
    }

    @Override
    public Optional<String> convertDttm(String targetType, LocalDateTime dttm) {
        return Optional.of("'" + SQL_DTTM.format(dttm) + "'");
    }
}
