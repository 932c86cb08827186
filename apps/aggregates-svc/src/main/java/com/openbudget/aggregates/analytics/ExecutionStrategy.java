package com.openbudget.aggregates.analytics;

/**
 * Where normalization and aggregation run.
 */
public enum ExecutionStrategy {
    /** Rows grouped by classification and year are fetched and normalized in the service. */
    IN_MEMORY,
    /** A per-year multiplier table is handed to the store, which normalizes, groups and pages. */
    STORE_DELEGATED
}
