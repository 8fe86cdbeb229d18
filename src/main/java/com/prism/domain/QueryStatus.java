package com.prism.domain;

/**
 * Outcome of a single query execution
 */
public enum QueryStatus {
    SUCCESS,
    FAILED
}
