package com.prism.query.sql;

/**
 * Something a SELECT can read from
 */
public interface FromClause extends SqlClause {
}
