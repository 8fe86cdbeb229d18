package com.prism.dialect;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Database engine specification.
 *
 * Holds everything that differs between physical databases when generating
 * SQL: identifier quoting, time grain templates, epoch conversion templates
 * and date/time literal conversion. This base class describes a generic
 * ANSI-ish engine; concrete engines override what they need.
 */
public class BaseEngineSpec {

    protected static final DateTimeFormatter SQL_DTTM =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    protected static final TimeGrain TIME_COLUMN =
            new TimeGrain("Time Column", "Time Column", TimeGrain.COLUMN_PLACEHOLDER);

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_$]*");

    private static final Set<String> RESERVED_WORDS = Set.of(
            "all", "and", "as", "asc", "between", "by", "case", "cast", "create", "cross",
            "current_date", "current_time", "current_timestamp", "default", "delete", "desc",
            "distinct", "else", "end", "except", "exists", "false", "for", "from", "full",
            "group", "having", "in", "inner", "insert", "intersect", "into", "is", "join",
            "left", "like", "limit", "not", "null", "offset", "on", "or", "order", "outer",
            "right", "select", "table", "then", "to", "true", "union", "update", "user",
            "using", "values", "when", "where", "with");

    private final Map<String, TimeGrain> grainsByName;

    public BaseEngineSpec() {
        Map<String, TimeGrain> byName = new LinkedHashMap<>();
        for (TimeGrain grain : timeGrains()) {
            byName.put(grain.getName(), grain);
        }
        this.grainsByName = Collections.unmodifiableMap(byName);
    }

    /**
     * Engine identifier, matched against configuration and JDBC URLs
     */
    public String getEngine() {
        return "base";
    }

    public String getIdentifierQuote() {
        return "\"";
    }

    /**
     * Whether literal SQL text handed to this engine's driver has its
     * percent signs doubled (format-style parameter markers)
     */
    public boolean escapesPercent() {
        return false;
    }

    /**
     * Grains supported by this engine, in display order
     */
    protected List<TimeGrain> timeGrains() {
        return List.of(TIME_COLUMN);
    }

    public List<TimeGrain> getTimeGrains() {
        return List.copyOf(grainsByName.values());
    }

    public Map<String, TimeGrain> getGrainsByName() {
        return grainsByName;
    }

    public Optional<TimeGrain> findGrain(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(grainsByName.get(name));
    }

    /**
     * Template turning seconds since the epoch into a timestamp expression
     */
    public String epochToDttm() {
        return "(TIMESTAMP '1970-01-01 00:00:00' + {col} * INTERVAL '1' SECOND)";
    }

    /**
     * Template turning milliseconds since the epoch into a timestamp expression
     */
    public String epochMsToDttm() {
        return epochToDttm().replace(TimeGrain.COLUMN_PLACEHOLDER, "({col}/1000.0)");
    }

    /**
     * Render a date/time value as a SQL literal for a column of the given
     * declared type. Empty means this engine has no special handling.
     */
    public Optional<String> convertDttm(String targetType, LocalDateTime dttm) {
        return Optional.empty();
    }

    /**
     * Quote an identifier when it is not a plain lower case name or collides
     * with a reserved word
     */
    public String quoteIdentifier(String name) {
        if (PLAIN_IDENTIFIER.matcher(name).matches()
                && !RESERVED_WORDS.contains(name.toLowerCase(Locale.ROOT))) {
            return name;
        }
        String quote = getIdentifierQuote();
        return quote + name.replace(quote, quote + quote) + quote;
    }

    protected static String upper(String targetType) {
        return targetType == null ? "" : targetType.toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return getEngine();
    }
}
