package com.prism.query;

import com.prism.dialect.BaseEngineSpec;
import com.prism.dialect.TimeGrain;
import com.prism.domain.SqlTable;
import com.prism.domain.TableColumn;
import com.prism.query.sql.ColumnClause;
import com.prism.query.sql.Label;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps table columns to SQL expressions.
 *
 * A column without an expression is referenced by its (quoted) name; a
 * column with an expression contributes that text verbatim. The time axis
 * variant applies epoch conversion and grain truncation and is always
 * aliased {@value #DTTM_ALIAS}.
 */
@Component
public class ColumnExpressionResolver {

    private static final Logger logger = LoggerFactory.getLogger(ColumnExpressionResolver.class);

    public static final String DTTM_ALIAS = "__timestamp";

    public Label resolve(TableColumn column) {
        String name = column.getColumnName();
        if (!column.hasExpression()) {
            return ColumnClause.column(name).label(name);
        }
        return ColumnClause.literalColumn(column.getExpression()).label(name);
    }

    /**
     * Resolves a column by name; unknown names fail
     */
    public Label resolve(SqlTable table, String columnName) {
        return resolve(requireColumn(table, columnName));
    }

    public TableColumn requireColumn(SqlTable table, String columnName) {
        TableColumn column = table.getColumn(columnName);
        if (column == null) {
            throw new QueryValidationException(
                    "Column '" + columnName + "' is not valid", table.getName(), columnName);
        }
        return column;
    }

    /**
     * Time axis expression for a column, truncated to the given grain.
     * An unknown grain leaves the expression untruncated.
     */
    public Label timestampExpression(TableColumn column, String timeGrain, BaseEngineSpec engineSpec) {
        boolean grainRequested = timeGrain != null && !timeGrain.isEmpty();
        if (!column.hasExpression() && !grainRequested) {
            return ColumnClause.dateTimeColumn(column.getColumnName()).label(DTTM_ALIAS);
        }

        String expression = column.hasExpression() ? column.getExpression() : column.getColumnName();
        if (grainRequested) {
            if (TableColumn.EPOCH_S.equals(column.getDateFormat())) {
                expression = engineSpec.epochToDttm().replace(TimeGrain.COLUMN_PLACEHOLDER, expression);
            } else if (TableColumn.EPOCH_MS.equals(column.getDateFormat())) {
                expression = engineSpec.epochMsToDttm().replace(TimeGrain.COLUMN_PLACEHOLDER, expression);
            }
            Optional<TimeGrain> grain = engineSpec.findGrain(timeGrain);
            if (grain.isPresent()) {
                expression = grain.get().apply(expression);
            } else {
                logger.debug("Time grain '{}' not supported by engine {}, leaving {} untruncated",
                        timeGrain, engineSpec.getEngine(), column.getColumnName());
            }
        }
        return ColumnClause.literalDateTimeColumn(expression).label(DTTM_ALIAS);
    }
}
