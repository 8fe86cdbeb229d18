package com.prism.dialect;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Presto / Trino
 */
public class PrestoEngineSpec extends BaseEngineSpec {

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter ISO_DTTM = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    @Override
    public String getEngine() {
        return "presto";
    }

    @Override
    public boolean escapesPercent() {
        return true;
    }

    @Override
    protected List<TimeGrain> timeGrains() {
        return List.of(
                TIME_COLUMN,
                new TimeGrain("second", "second", "date_trunc('second', CAST({col} AS TIMESTAMP))"),
                new TimeGrain("minute", "minute", "date_trunc('minute', CAST({col} AS TIMESTAMP))"),
                new TimeGrain("hour", "hour", "date_trunc('hour', CAST({col} AS TIMESTAMP))"),
                new TimeGrain("day", "day", "date_trunc('day', CAST({col} AS TIMESTAMP))"),
                new TimeGrain("week", "week", "date_trunc('week', CAST({col} AS TIMESTAMP))"),
                new TimeGrain("month", "month", "date_trunc('month', CAST({col} AS TIMESTAMP))"),
                new TimeGrain("quarter", "quarter", "date_trunc('quarter', CAST({col} AS TIMESTAMP))"),
                new TimeGrain("year", "year", "date_trunc('year', CAST({col} AS TIMESTAMP))"));
    }

    @Override
    public String epochToDttm() {
        return "from_unixtime({col})";
    }

    @Override
    public Optional<String> convertDttm(String targetType, LocalDateTime dttm) {
        String type = upper(targetType);
        if (type.equals("DATE")) {
            return Optional.of("from_iso8601_date('" + ISO_DATE.format(dttm) + "')");
        }
        if (type.equals("TIMESTAMP")) {
            return Optional.of("from_iso8601_timestamp('" + ISO_DTTM.format(dttm) + "')");
        }
        return Optional.of("'" + SQL_DTTM.format(dttm) + "'");
    }
}
