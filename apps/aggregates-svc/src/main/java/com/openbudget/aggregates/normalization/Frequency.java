package com.openbudget.aggregates.normalization;

/**
 * Reporting granularity of budget periods and of the factor maps generated for them.
 */
public enum Frequency {
    MONTH,
    QUARTER,
    YEAR
}
