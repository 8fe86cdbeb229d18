package com.prism.query;

import com.prism.dialect.BaseEngineSpec;
import com.prism.domain.TableColumn;
import com.prism.query.sql.BinaryClause;
import com.prism.query.sql.BooleanClauseList;
import com.prism.query.sql.Label;
import com.prism.query.sql.SqlClause;
import com.prism.query.sql.TextClause;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds inclusive range predicates over a time column with the bounds
 * rendered as engine literals.
 *
 * Literal rendering, first match wins:
 * <ol>
 *   <li>the column's database expression, its {@code {}} receiving {@code yyyy-MM-dd HH:mm:ss}</li>
 *   <li>{@code epoch_s}: seconds since the epoch</li>
 *   <li>{@code epoch_ms}: milliseconds since the epoch</li>
 *   <li>the engine's own conversion for the column type, else a quoted
 *   string in the column's date format</li>
 * </ol>
 * Instants are read as UTC.
 */
@Component
public class TimeFilterBuilder {

    public static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd HH:mm:ss.SSSSSS";

    private static final DateTimeFormatter DATABASE_EXPRESSION_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final ColumnExpressionResolver columnResolver;

    public TimeFilterBuilder(ColumnExpressionResolver columnResolver) {
        this.columnResolver = columnResolver;
    }

    /**
     * {@code col >= start AND col <= end}; a null bound contributes no predicate
     */
    public BooleanClauseList build(TableColumn column, TimeRange range, BaseEngineSpec engineSpec) {
        Label expression = columnResolver.resolve(column);
        List<SqlClause> predicates = new ArrayList<>();
        if (range.getFrom() != null) {
            predicates.add(BinaryClause.ge(expression, new TextClause(toSqlLiteral(column, range.getFrom(), engineSpec))));
        }
        if (range.getTo() != null) {
            predicates.add(BinaryClause.le(expression, new TextClause(toSqlLiteral(column, range.getTo(), engineSpec))));
        }
        return new BooleanClauseList(predicates);
    }

    public String toSqlLiteral(TableColumn column, LocalDateTime dttm, BaseEngineSpec engineSpec) {
        String format = column.getDateFormat() != null && !column.getDateFormat().isEmpty()
                ? column.getDateFormat() : DEFAULT_DATE_FORMAT;

        if (column.getDatabaseExpression() != null && !column.getDatabaseExpression().isEmpty()) {
            return column.getDatabaseExpression().replace("{}", DATABASE_EXPRESSION_FORMAT.format(dttm));
        } else if (TableColumn.EPOCH_S.equals(format)) {
            return toDecimalString(epochSeconds(dttm));
        } else if (TableColumn.EPOCH_MS.equals(format)) {
            return toDecimalString(epochSeconds(dttm).multiply(THOUSAND));
        }

        Optional<String> converted = engineSpec.convertDttm(column.getType(), dttm);
        if (converted.isPresent()) {
            return converted.get();
        }
        try {
            return "'" + DateTimeFormatter.ofPattern(format).format(dttm) + "'";
        } catch (IllegalArgumentException e) {
            throw new DatasourceConfigurationException(
                    "Invalid date format '" + format + "' on column " + column.getColumnName(), null, e);
        }
    }

    static BigDecimal epochSeconds(LocalDateTime dttm) {
        return BigDecimal.valueOf(dttm.toEpochSecond(ZoneOffset.UTC))
                .add(BigDecimal.valueOf(dttm.getNano(), 9));
    }

    /**
     * Plain decimal with at least one fractional digit, e.g. {@code 1577836800.0}
     */
    static String toDecimalString(BigDecimal value) {
        BigDecimal normalized = value.stripTrailingZeros();
        if (normalized.scale() < 1) {
            normalized = normalized.setScale(1);
        }
        return normalized.toPlainString();
    }
}
