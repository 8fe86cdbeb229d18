package com.prism.query.sql;

/**
 * Base type of every node of the SQL tree rendered by {@link SqlCompiler}
 */
public interface SqlClause {
}
