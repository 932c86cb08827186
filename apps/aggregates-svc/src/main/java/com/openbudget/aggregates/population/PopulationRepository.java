package com.openbudget.aggregates.population;

import com.openbudget.aggregates.analytics.AggregationResult;
import com.openbudget.aggregates.model.AnalyticsFilter;
import java.math.BigDecimal;

/**
 * Current (not historical) population figures used as per-capita denominators.
 */
public interface PopulationRepository {

    String BUCHAREST_COUNTY_CODE = "B";
    String BUCHAREST_SIRUTA_CODE = "179132";
    String COUNTY_COUNCIL_ENTITY_TYPE = "admin_county_council";

    /**
     * Sum of county-level units, Bucharest read from its municipal unit.
     */
    AggregationResult<BigDecimal> getCountryPopulation();

    /**
     * Population covered by the entity, UAT, county and entity-type constraints of the filter.
     * A unit is counted once however many matching entities map to it.
     */
    AggregationResult<BigDecimal> getFilteredPopulation(AnalyticsFilter filter);
}
