package com.prism.query.sql;

/**
 * A column reference.
 *
 * A non-literal column renders as a (quoted when needed) identifier. A
 * literal column renders its text verbatim, which is how derived column
 * expressions and time grain expressions enter the statement.
 */
public class ColumnClause implements SqlClause {

    private final String text;
    private final boolean literal;
    private final boolean dateTime;

    private ColumnClause(String text, boolean literal, boolean dateTime) {
        this.text = text;
        this.literal = literal;
        this.dateTime = dateTime;
    }

    public static ColumnClause column(String name) {
        return new ColumnClause(name, false, false);
    }

    public static ColumnClause dateTimeColumn(String name) {
        return new ColumnClause(name, false, true);
    }

    public static ColumnClause literalColumn(String expression) {
        return new ColumnClause(expression, true, false);
    }

    public static ColumnClause literalDateTimeColumn(String expression) {
        return new ColumnClause(expression, true, true);
    }

    public String getText() {
        return text;
    }

    public boolean isLiteral() {
        return literal;
    }

    /**
     * Whether the column is typed as a date-time value
     */
    public boolean isDateTime() {
        return dateTime;
    }

    public Label label(String name) {
        return new Label(this, name);
    }

    @Override
    public String toString() {
        return text;
    }
}
