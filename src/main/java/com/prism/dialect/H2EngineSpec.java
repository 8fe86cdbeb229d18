package com.prism.dialect;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * H2 (2.x)
 */
public class H2EngineSpec extends BaseEngineSpec {

    @Override
    public String getEngine() {
        return "h2";
    }

    @Override
    protected List<TimeGrain> timeGrains() {
        return List.of(
                TIME_COLUMN,
                new TimeGrain("second", "second", "DATE_TRUNC(SECOND, {col})"),
                new TimeGrain("minute", "minute", "DATE_TRUNC(MINUTE, {col})"),
                new TimeGrain("hour", "hour", "DATE_TRUNC(HOUR, {col})"),
                new TimeGrain("day", "day", "DATE_TRUNC(DAY, {col})"),
                new TimeGrain("week", "week", "DATE_TRUNC(WEEK, {col})"),
                new TimeGrain("month", "month", "DATE_TRUNC(MONTH, {col})"),
                new TimeGrain("quarter", "quarter", "DATE_TRUNC(QUARTER, {col})"),
                new TimeGrain("year", "year", "DATE_TRUNC(YEAR, {col})"));
    }

    @Override
    public String epochToDttm() {
        return "DATEADD(SECOND, {col}, TIMESTAMP '1970-01-01 00:00:00')";
    }

    @Override
    public String epochMsToDttm() {
        return "DATEADD(MILLISECOND, {col}, TIMESTAMP '1970-01-01 00:00:00')";
    }

    @Override
    public Optional<String> convertDttm(String targetType, LocalDateTime dttm) {
        String type = upper(targetType);
        if (type.startsWith("TIMESTAMP") || type.equals("DATE")) {
            return Optional.of("TIMESTAMP '" + SQL_DTTM.format(dttm) + "'");
        }
        return Optional.empty();
    }
}
