package com.prism.dialect;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MySQL / MariaDB
 */
public class MySqlEngineSpec extends BaseEngineSpec {

    @Override
    public String getEngine() {
        return "mysql";
    }

    @Override
    public String getIdentifierQuote() {
        return "`";
    }

    @Override
    public boolean escapesPercent() {
        return true;
    }

    @Override
    protected List<TimeGrain> timeGrains() {
        return List.of(
                TIME_COLUMN,
                new TimeGrain("second", "second",
                        "DATE_ADD(DATE({col}), INTERVAL (HOUR({col})*60*60 + MINUTE({col})*60 + SECOND({col})) SECOND)"),
                new TimeGrain("minute", "minute",
                        "DATE_ADD(DATE({col}), INTERVAL (HOUR({col})*60 + MINUTE({col})) MINUTE)"),
                new TimeGrain("hour", "hour", "DATE_ADD(DATE({col}), INTERVAL HOUR({col}) HOUR)"),
                new TimeGrain("day", "day", "DATE({col})"),
                new TimeGrain("week", "week", "DATE(DATE_SUB({col}, INTERVAL DAYOFWEEK({col}) - 1 DAY))"),
                new TimeGrain("month", "month", "DATE_FORMAT({col}, '%Y-%m-01')"),
                new TimeGrain("quarter", "quarter",
                        "MAKEDATE(YEAR({col}), 1) + INTERVAL QUARTER({col}) QUARTER - INTERVAL 1 QUARTER"),
                new TimeGrain("year", "year", "DATE_FORMAT({col}, '%Y-01-01')"),
                new TimeGrain("week_start_monday", "week_start_monday",
                        "DATE(DATE_SUB({col}, INTERVAL DAYOFWEEK(DATE_SUB({col}, INTERVAL 1 DAY)) - 1 DAY))"));
    }

    @Override
    public String epochToDttm() {
        return "from_unixtime({col})";
    }

    @Override
    public Optional<String> convertDttm(String targetType, LocalDateTime dttm) {
        String type = upper(targetType);
        if (type.equals("DATETIME") || type.equals("DATE")) {
            return Optional.of("STR_TO_DATE('" + SQL_DTTM.format(dttm) + "', '%Y-%m-%d %H:%i:%s')");
        }
        return Optional.of("'" + SQL_DTTM.format(dttm) + "'");
    }
}
