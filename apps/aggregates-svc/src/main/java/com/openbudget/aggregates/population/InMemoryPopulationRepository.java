package com.openbudget.aggregates.population;

import com.openbudget.aggregates.analytics.AggregationResult;
import com.openbudget.aggregates.model.AnalyticsFilter;
import com.openbudget.aggregates.repository.BudgetSeed;
import com.openbudget.aggregates.repository.InMemoryBudgetStore;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

public class InMemoryPopulationRepository implements PopulationRepository {

    private final InMemoryBudgetStore store;

    public InMemoryPopulationRepository(InMemoryBudgetStore store) {
        this.store = store;
    }

    @Override
    public AggregationResult<BigDecimal> getCountryPopulation() {
        return AggregationResult.ok(sum(countyUnits(store.uats())));
    }

    @Override
    public AggregationResult<BigDecimal> getFilteredPopulation(AnalyticsFilter filter) {
        if (!filter.entityCuis().isEmpty()) {
            return AggregationResult.ok(sumEntityUnits(entity -> filter.entityCuis().contains(entity.cui())));
        }
        if (!filter.uatIds().isEmpty()) {
            List<BudgetSeed.Uat> units = store.uats().stream()
                    .filter(uat -> filter.uatIds().contains(uat.id()))
                    .toList();
            return AggregationResult.ok(sum(units));
        }
        if (!filter.countyCodes().isEmpty()) {
            return AggregationResult.ok(sum(countyUnits(byCounty(filter.countyCodes()))));
        }
        if (!filter.entityTypes().isEmpty()) {
            if (filter.entityTypes().contains(COUNTY_COUNCIL_ENTITY_TYPE)) {
                Set<String> counties = store.entities().stream()
                        .filter(entity -> COUNTY_COUNCIL_ENTITY_TYPE.equals(entity.entityType()))
                        .map(entity -> store.uat(entity.uatId()).map(BudgetSeed.Uat::countyCode).orElse(null))
                        .filter(Objects::nonNull)
                        .collect(Collectors.toSet());
                return AggregationResult.ok(sum(countyUnits(byCounty(counties))));
            }
            Boolean isUat = filter.isUat();
            return AggregationResult.ok(sumEntityUnits(entity -> filter.entityTypes().contains(entity.entityType())
                    && (isUat == null || isUat == entity.isUat())));
        }
        if (Boolean.TRUE.equals(filter.isUat())) {
            return AggregationResult.ok(sumEntityUnits(BudgetSeed.Entity::isUat));
        }
        return getCountryPopulation();
    }

    private BigDecimal sumEntityUnits(Predicate<BudgetSeed.Entity> predicate) {
        Map<Long, BudgetSeed.Uat> units = new LinkedHashMap<>();
        for (BudgetSeed.Entity entity : store.entities()) {
            if (predicate.test(entity)) {
                store.uat(entity.uatId()).ifPresent(uat -> units.putIfAbsent(uat.id(), uat));
            }
        }
        return sum(units.values());
    }

    private List<BudgetSeed.Uat> byCounty(Collection<String> countyCodes) {
        return store.uats().stream()
                .filter(uat -> countyCodes.contains(uat.countyCode()))
                .toList();
    }

    private static List<BudgetSeed.Uat> countyUnits(List<BudgetSeed.Uat> uats) {
        return uats.stream().filter(InMemoryPopulationRepository::isCountyUnit).toList();
    }

    static boolean isCountyUnit(BudgetSeed.Uat uat) {
        if (BUCHAREST_COUNTY_CODE.equals(uat.countyCode())) {
            return BUCHAREST_SIRUTA_CODE.equals(uat.sirutaCode());
        }
        return uat.sirutaCode() != null && uat.sirutaCode().equals(uat.countyCode());
    }

    private static BigDecimal sum(Collection<BudgetSeed.Uat> units) {
        return units.stream()
                .map(BudgetSeed.Uat::population)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
