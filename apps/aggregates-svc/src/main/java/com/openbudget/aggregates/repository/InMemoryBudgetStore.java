package com.openbudget.aggregates.repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable indexed view over a {@link BudgetSeed}, shared by the in-memory adapters.
 */
public class InMemoryBudgetStore {

    private final BudgetSeed seed;
    private final Map<String, BudgetSeed.Entity> entitiesByCui;
    private final Map<Long, BudgetSeed.Uat> uatsById;

    public InMemoryBudgetStore(BudgetSeed seed) {
        this.seed = seed;
        this.entitiesByCui = seed.entities().stream()
                .collect(Collectors.toMap(BudgetSeed.Entity::cui, Function.identity(), (first, second) -> second));
        this.uatsById = seed.uats().stream()
                .collect(Collectors.toMap(BudgetSeed.Uat::id, Function.identity(), (first, second) -> second));
    }

    public List<BudgetSeed.LineItem> lineItems() {
        return seed.lineItems();
    }

    public List<BudgetSeed.Uat> uats() {
        return seed.uats();
    }

    public List<BudgetSeed.Entity> entities() {
        return seed.entities();
    }

    public Optional<BudgetSeed.Entity> entity(String cui) {
        return Optional.ofNullable(cui).map(entitiesByCui::get);
    }

    public Optional<BudgetSeed.Uat> uat(Long id) {
        return Optional.ofNullable(id).map(uatsById::get);
    }

    public Optional<String> functionalName(String functionalCode) {
        return Optional.ofNullable(functionalCode).map(seed.functionalClassifications()::get);
    }

    public Optional<String> economicName(String economicCode) {
        return Optional.ofNullable(economicCode).map(seed.economicClassifications()::get);
    }
}
