package com.openbudget.aggregates.population;

import com.openbudget.aggregates.analytics.AggregationResult;
import com.openbudget.aggregates.model.AnalyticsFilter;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the population a per-capita query divides by: the country total when the filter covers
 * every entity, otherwise the population of the units the filter selects.
 */
@Component
public class PopulationDenominatorResolver {

    private static final Logger log = LoggerFactory.getLogger(PopulationDenominatorResolver.class);

    private final PopulationRepository populationRepository;

    public PopulationDenominatorResolver(PopulationRepository populationRepository) {
        this.populationRepository = populationRepository;
    }

    /**
     * Empty when the population could not be read; callers then fall back to the yearly series.
     */
    public Optional<BigDecimal> resolve(AnalyticsFilter filter) {
        boolean filtered = filter.narrowsPopulation();
        AggregationResult<BigDecimal> result = filtered
                ? populationRepository.getFilteredPopulation(filter)
                : populationRepository.getCountryPopulation();
        if (!result.isOk()) {
            log.warn("population_denominator_unavailable scope={} reason={}",
                    filtered ? "filtered" : "country", result.error().message());
            return Optional.empty();
        }
        log.debug("population_denominator_resolved scope={} population={}", filtered ? "filtered" : "country", result.value());
        return Optional.of(result.value());
    }
}
