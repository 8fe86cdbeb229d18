package com.prism.query.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * A SELECT statement under construction.
 *
 * WHERE and HAVING entries are conjoined. Mutators return this so a
 * statement can be assembled fluently.
 */
public class Select implements SqlClause {

    private final List<SqlClause> columns = new ArrayList<>();
    private boolean distinct;
    private FromClause from;
    private final List<SqlClause> where = new ArrayList<>();
    private final List<SqlClause> groupBy = new ArrayList<>();
    private final List<SqlClause> having = new ArrayList<>();
    private final List<OrderByItem> orderBy = new ArrayList<>();
    private Integer limit;

    public Select(List<? extends SqlClause> columns) {
        this.columns.addAll(columns);
    }

    public Select distinct() {
        this.distinct = true;
        return this;
    }

    public Select from(FromClause from) {
        this.from = from;
        return this;
    }

    public Select where(SqlClause clause) {
        this.where.add(clause);
        return this;
    }

    public Select groupBy(List<? extends SqlClause> clauses) {
        this.groupBy.addAll(clauses);
        return this;
    }

    public Select having(SqlClause clause) {
        this.having.add(clause);
        return this;
    }

    public Select orderBy(OrderByItem item) {
        this.orderBy.add(item);
        return this;
    }

    public Select limit(Integer limit) {
        this.limit = limit;
        return this;
    }

    public List<SqlClause> getColumns() {
        return columns;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public FromClause getFrom() {
        return from;
    }

    public List<SqlClause> getWhere() {
        return where;
    }

    public List<SqlClause> getGroupBy() {
        return groupBy;
    }

    public List<SqlClause> getHaving() {
        return having;
    }

    public List<OrderByItem> getOrderBy() {
        return orderBy;
    }

    public Integer getLimit() {
        return limit;
    }
}
