package com.openbudget.aggregates.repository;

import com.openbudget.aggregates.analytics.AggregationResult;
import com.openbudget.aggregates.model.AggregatedClassification;
import com.openbudget.aggregates.model.AnalyticsFilter;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Store-side normalization: each row's amount is multiplied by the precomputed multiplier for its
 * year before the store groups, filters, orders and pages. Rows whose year has no multiplier are
 * left out.
 */
public interface NormalizedAggregateRepository {

    AggregationResult<NormalizedAggregatedResult> getNormalizedAggregatedItems(
            AnalyticsFilter filter,
            Map<String, BigDecimal> factorMap,
            Pagination pagination,
            AggregateFilters aggregateFilters
    );

    record Pagination(int limit, int offset) {
    }

    record NormalizedAggregatedResult(List<AggregatedClassification> items, long totalCount) {
    }
}
