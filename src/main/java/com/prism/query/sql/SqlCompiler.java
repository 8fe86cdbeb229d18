package com.prism.query.sql;

import com.prism.dialect.BaseEngineSpec;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link Select} tree to SQL text for one engine.
 *
 * Two layouts are produced from the same tree: a compact single-line form
 * and a reindented form with one clause per line. Both contain the same
 * tokens; only whitespace differs.
 */
public class SqlCompiler {

    private static final String SELECT = "SELECT ";
    private static final String SELECT_DISTINCT = "SELECT DISTINCT ";

    private final BaseEngineSpec engineSpec;
    private final RenderOptions options;

    public SqlCompiler(BaseEngineSpec engineSpec, RenderOptions options) {
        this.engineSpec = engineSpec;
        this.options = options;
    }

    public String compile(Select select) {
        return renderSelect(select, 0);
    }

    private String renderSelect(Select select, int indent) {
        StringBuilder sql = new StringBuilder();

        // SELECT clause
        String head = select.isDistinct() ? SELECT_DISTINCT : SELECT;
        sql.append(head);
        List<String> columns = new ArrayList<>();
        for (SqlClause column : select.getColumns()) {
            columns.add(renderSelectItem(column));
        }
        sql.append(String.join(listSeparator(indent + head.length()), columns));

        // FROM clause
        if (select.getFrom() != null) {
            sql.append(newline(indent)).append("FROM ");
            sql.append(renderFrom(select.getFrom(), indent));
        }

        // WHERE clause
        if (!select.getWhere().isEmpty()) {
            sql.append(newline(indent)).append("WHERE ");
            sql.append(renderConjunction(select.getWhere(), indent));
        }

        // GROUP BY clause
        if (!select.getGroupBy().isEmpty()) {
            List<String> items = new ArrayList<>();
            for (SqlClause clause : select.getGroupBy()) {
                items.add(renderExpression(clause));
            }
            sql.append(newline(indent)).append("GROUP BY ");
            sql.append(String.join(listSeparator(indent + 9), items));
        }

        // HAVING clause
        if (!select.getHaving().isEmpty()) {
            sql.append(newline(indent)).append("HAVING ");
            sql.append(renderConjunction(select.getHaving(), indent));
        }

        // ORDER BY clause
        if (!select.getOrderBy().isEmpty()) {
            List<String> items = new ArrayList<>();
            for (OrderByItem item : select.getOrderBy()) {
                items.add(renderOrderByItem(item, select));
            }
            sql.append(newline(indent)).append("ORDER BY ");
            sql.append(String.join(listSeparator(indent + 9), items));
        }

        // LIMIT clause
        if (select.getLimit() != null) {
            sql.append(newline(indent)).append("LIMIT ").append(select.getLimit());
        }

        return sql.toString();
    }

    private String renderSelectItem(SqlClause column) {
        if (column instanceof Label) {
            Label label = (Label) column;
            return renderExpression(label.getElement()) + " AS " + engineSpec.quoteIdentifier(label.getName());
        }
        return renderExpression(column);
    }

    /**
     * A label that is projected by the same select is sorted by its alias
     */
    private String renderOrderByItem(OrderByItem item, Select scope) {
        SqlClause element = item.getElement();
        String rendered;
        if (element instanceof Label && isProjected((Label) element, scope)) {
            rendered = engineSpec.quoteIdentifier(((Label) element).getName());
        } else {
            rendered = renderExpression(element);
        }
        return rendered + (item.isAscending() ? " ASC" : " DESC");
    }

    private boolean isProjected(Label label, Select scope) {
        for (SqlClause column : scope.getColumns()) {
            if (column == label) {
                return true;
            }
        }
        return false;
    }

    private String renderFrom(FromClause from, int indent) {
        if (from instanceof TableRef) {
            TableRef table = (TableRef) from;
            String name = engineSpec.quoteIdentifier(table.getName());
            if (table.getSchema() != null && !table.getSchema().isEmpty()) {
                return engineSpec.quoteIdentifier(table.getSchema()) + "." + name;
            }
            return name;
        } else if (from instanceof TextSource) {
            TextSource source = (TextSource) from;
            return "(" + source.getSql() + ") AS " + engineSpec.quoteIdentifier(source.getAlias());
        } else if (from instanceof Join) {
            Join join = (Join) from;
            StringBuilder sql = new StringBuilder(renderFrom(join.getLeft(), indent));
            if (options.isPretty()) {
                sql.append(newline(indent)).append("JOIN").append(newline(indent + 2)).append("(");
            } else {
                sql.append(" JOIN (");
            }
            sql.append(renderSelect(join.getSubquery(), indent + 3));
            sql.append(") AS ").append(engineSpec.quoteIdentifier(join.getAlias()));
            sql.append(" ON ").append(renderExpression(join.getOnClause()));
            return sql.toString();
        }
        throw new IllegalArgumentException("Unsupported from clause: " + from.getClass().getSimpleName());
    }

    private String renderConjunction(List<SqlClause> clauses, int indent) {
        List<String> parts = new ArrayList<>();
        for (SqlClause clause : BooleanClauseList.and(clauses.toArray(new SqlClause[0])).flatten()) {
            parts.add(renderExpression(clause));
        }
        String separator = options.isPretty() ? "\n" + pad(indent) + "  AND " : " AND ";
        return String.join(separator, parts);
    }

    /**
     * Render a clause in expression position, where labels stand for their element
     */
    private String renderExpression(SqlClause clause) {
        if (clause instanceof Label) {
            return renderExpression(((Label) clause).getElement());
        } else if (clause instanceof ColumnClause) {
            return renderColumn((ColumnClause) clause);
        } else if (clause instanceof TextClause) {
            return ((TextClause) clause).getText();
        } else if (clause instanceof Grouping) {
            return "(" + renderExpression(((Grouping) clause).getElement()) + ")";
        } else if (clause instanceof BinaryClause) {
            BinaryClause binary = (BinaryClause) clause;
            return renderExpression(binary.getLeft()) + " " + binary.getOperator() + " "
                    + renderExpression(binary.getRight());
        } else if (clause instanceof InClause) {
            return renderIn((InClause) clause);
        } else if (clause instanceof BooleanClauseList) {
            List<String> parts = new ArrayList<>();
            for (SqlClause part : ((BooleanClauseList) clause).flatten()) {
                parts.add(renderExpression(part));
            }
            return String.join(" AND ", parts);
        }
        throw new IllegalArgumentException("Unsupported clause: " + clause.getClass().getSimpleName());
    }

    private String renderColumn(ColumnClause column) {
        if (!column.isLiteral()) {
            return engineSpec.quoteIdentifier(column.getText());
        }
        String text = column.getText();
        if (options.isFormatStyleParams() && engineSpec.escapesPercent()) {
            text = text.replace("%", "%%");
            if (options.isUnescapeDateTimePercent() && isLiteralDateTime(column)) {
                text = text.replace("%%", "%");
            }
        }
        return text;
    }

    private boolean isLiteralDateTime(ColumnClause column) {
        return column.isLiteral() && column.isDateTime() && options.isLiteralBinds();
    }

    private String renderIn(InClause in) {
        List<String> values = new ArrayList<>();
        for (Object value : in.getValues()) {
            values.add(renderLiteral(value));
        }
        return renderExpression(in.getElement()) + (in.isNegated() ? " NOT IN (" : " IN (")
                + String.join(", ", values) + ")";
    }

    static String renderLiteral(Object value) {
        if (value == null) {
            return "NULL";
        } else if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        } else if (value instanceof Number) {
            return value.toString();
        } else if (value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }

    private String listSeparator(int alignment) {
        return options.isPretty() ? ",\n" + pad(alignment) : ", ";
    }

    private String newline(int indent) {
        return options.isPretty() ? "\n" + pad(indent) : " ";
    }

    private static String pad(int width) {
        return " ".repeat(width);
    }
}
