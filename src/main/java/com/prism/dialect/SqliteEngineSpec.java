package com.prism.dialect;

import java.util.List;

/**
 * SQLite. Date/time literals use the column's own format pattern.
 */
public class SqliteEngineSpec extends BaseEngineSpec {

    @Override
    public String getEngine() {
        return "sqlite";
    }

    @Override
    protected List<TimeGrain> timeGrains() {
        return List.of(
                TIME_COLUMN,
                new TimeGrain("hour", "hour", "DATETIME(STRFTIME('%Y-%m-%dT%H:00:00', {col}))"),
                new TimeGrain("day", "day", "DATE({col})"),
                new TimeGrain("week", "week", "DATE({col}, -strftime('%w', {col}) || ' days')"),
                new TimeGrain("month", "month", "DATE({col}, -strftime('%d', {col}) || ' days', '+1 day')"));
    }

    @Override
    public String epochToDttm() {
        return "datetime({col}, 'unixepoch')";
    }
}
