package com.prism.query.sql;

/**
 * {@code left <operator> right}
 */
public class BinaryClause implements SqlClause {

    private final SqlClause left;
    private final String operator;
    private final SqlClause right;

    public BinaryClause(SqlClause left, String operator, SqlClause right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public static BinaryClause eq(SqlClause left, SqlClause right) {
        return new BinaryClause(left, "=", right);
    }

    public static BinaryClause ge(SqlClause left, SqlClause right) {
        return new BinaryClause(left, ">=", right);
    }

    public static BinaryClause le(SqlClause left, SqlClause right) {
        return new BinaryClause(left, "<=", right);
    }

    public SqlClause getLeft() {
        return left;
    }

    public String getOperator() {
        return operator;
    }

    public SqlClause getRight() {
        return right;
    }
}
