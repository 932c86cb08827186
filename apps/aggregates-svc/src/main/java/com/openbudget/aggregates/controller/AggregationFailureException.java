package com.openbudget.aggregates.controller;

import com.openbudget.aggregates.analytics.AggregationError;

/**
 * Carries a failed {@link com.openbudget.aggregates.analytics.AggregationResult} to the exception handler.
 */
public class AggregationFailureException extends RuntimeException {

    private final transient AggregationError error;

    public AggregationFailureException(AggregationError error) {
        super(error.message(), error.cause());
        this.error = error;
    }

    public AggregationError error() {
        return error;
    }
}
