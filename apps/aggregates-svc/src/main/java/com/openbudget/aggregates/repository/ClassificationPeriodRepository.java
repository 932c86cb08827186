package com.openbudget.aggregates.repository;

import com.openbudget.aggregates.analytics.AggregationResult;
import com.openbudget.aggregates.model.AnalyticsFilter;
import com.openbudget.aggregates.model.ClassificationPeriodRow;
import java.util.List;

/**
 * Line item amounts grouped by classification and year, not yet aggregated across years.
 * Filtering, classification joins and defaulting of missing economic codes happen here;
 * normalization, thresholds, ordering and paging do not.
 */
public interface ClassificationPeriodRepository {

    /** Safety cap on the number of grouped rows returned. */
    int MAX_ROWS = 100_000;

    AggregationResult<List<ClassificationPeriodRow>> getClassificationPeriodData(AnalyticsFilter filter);
}
