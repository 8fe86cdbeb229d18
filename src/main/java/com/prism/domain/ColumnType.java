package com.prism.domain;

/**
 * Coarse classification of a column's declared SQL type
 */
public enum ColumnType {
    NUMERIC,
    STRING,
    TEMPORAL,
    UNKNOWN
}
