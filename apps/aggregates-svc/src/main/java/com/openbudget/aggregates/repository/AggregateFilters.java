package com.openbudget.aggregates.repository;

import com.openbudget.aggregates.model.AnalyticsFilter;
import java.math.BigDecimal;

/**
 * Inclusive bounds on a classification's normalized total, the equivalent of a SQL HAVING clause.
 */
public record AggregateFilters(BigDecimal minAmount, BigDecimal maxAmount) {

    public static final AggregateFilters NONE = new AggregateFilters(null, null);

    public static AggregateFilters from(AnalyticsFilter filter) {
        return new AggregateFilters(filter.aggregateMinAmount(), filter.aggregateMaxAmount());
    }

    public boolean isEmpty() {
        return minAmount == null && maxAmount == null;
    }

    public boolean matches(BigDecimal amount) {
        if (minAmount != null && amount.compareTo(minAmount) < 0) {
            return false;
        }
        return maxAmount == null || amount.compareTo(maxAmount) <= 0;
    }
}
