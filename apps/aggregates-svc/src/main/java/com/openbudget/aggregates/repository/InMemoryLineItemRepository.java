package com.openbudget.aggregates.repository;

import com.openbudget.aggregates.analytics.AggregationResult;
import com.openbudget.aggregates.model.AggregatedClassification;
import com.openbudget.aggregates.model.AnalyticsFilter;
import com.openbudget.aggregates.model.ClassificationKey;
import com.openbudget.aggregates.model.ClassificationPeriodRow;
import com.openbudget.aggregates.normalization.Frequency;
import com.openbudget.aggregates.normalization.PeriodLabels;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Line item store held in memory. Applies the same filters, joins and defaults as the JDBC
 * adapter so both can back either execution strategy.
 */
public class InMemoryLineItemRepository implements ClassificationPeriodRepository, NormalizedAggregateRepository {

    private final InMemoryBudgetStore store;

    public InMemoryLineItemRepository(InMemoryBudgetStore store) {
        this.store = store;
    }

    @Override
    public AggregationResult<List<ClassificationPeriodRow>> getClassificationPeriodData(AnalyticsFilter filter) {
        Map<GroupKey, ClassificationPeriodRow> grouped = new LinkedHashMap<>();
        Frequency frequency = filter.reportPeriod().type();
        for (BudgetSeed.LineItem item : store.lineItems()) {
            Optional<Selected> selected = select(item, filter, frequency);
            if (selected.isEmpty()) {
                continue;
            }
            Selected row = selected.get();
            GroupKey key = new GroupKey(row.functionalCode(), row.economicCode(), item.year());
            if (grouped.size() >= MAX_ROWS && !grouped.containsKey(key)) {
                continue;
            }
            grouped.merge(key,
                    new ClassificationPeriodRow(row.functionalCode(), row.functionalName(), row.economicCode(), row.economicName(), item.year(), row.amount(), 1),
                    (existing, added) -> new ClassificationPeriodRow(
                            existing.functionalCode(),
                            existing.functionalName(),
                            existing.economicCode(),
                            existing.economicName(),
                            existing.year(),
                            existing.amount().add(added.amount()),
                            existing.count() + added.count()));
        }
        return AggregationResult.ok(new ArrayList<>(grouped.values()));
    }

    @Override
    public AggregationResult<NormalizedAggregatedResult> getNormalizedAggregatedItems(
            AnalyticsFilter filter,
            Map<String, BigDecimal> factorMap,
            Pagination pagination,
            AggregateFilters aggregateFilters
    ) {
        Map<ClassificationKey, AggregatedClassification> aggregated = new LinkedHashMap<>();
        Frequency frequency = filter.reportPeriod().type();
        for (BudgetSeed.LineItem item : store.lineItems()) {
            BigDecimal multiplier = factorMap.get(PeriodLabels.yearLabel(item.year()));
            if (multiplier == null) {
                continue;
            }
            Optional<Selected> selected = select(item, filter, frequency);
            if (selected.isEmpty()) {
                continue;
            }
            Selected row = selected.get();
            BigDecimal normalized = row.amount().multiply(multiplier);
            ClassificationKey key = new ClassificationKey(row.functionalCode(), row.economicCode());
            AggregatedClassification existing = aggregated.get(key);
            if (existing == null) {
                aggregated.put(key, new AggregatedClassification(key, row.functionalName(), row.economicName(), normalized, 1));
            } else {
                existing.add(normalized, 1);
            }
        }
        AggregateFilters having = aggregateFilters == null ? AggregateFilters.NONE : aggregateFilters;
        List<AggregatedClassification> filtered = aggregated.values().stream()
                .filter(item -> having.matches(item.amount()))
                .sorted(AggregatedClassification.BY_AMOUNT_DESC)
                .toList();
        int from = Math.min(pagination.offset(), filtered.size());
        int to = (int) Math.min((long) pagination.offset() + pagination.limit(), filtered.size());
        return AggregationResult.ok(new NormalizedAggregatedResult(new ArrayList<>(filtered.subList(from, to)), filtered.size()));
    }

    private Optional<Selected> select(BudgetSeed.LineItem item, AnalyticsFilter filter, Frequency frequency) {
        BigDecimal amount = item.amountFor(frequency);
        if (amount == null || !withinItemBounds(amount, filter) || !matches(item, filter)) {
            return Optional.empty();
        }
        Optional<String> functionalName = store.functionalName(item.functionalCode());
        if (functionalName.isEmpty()) {
            return Optional.empty();
        }
        String economicCode = item.economicCode() == null ? ClassificationPeriodRow.UNKNOWN_ECONOMIC_CODE : item.economicCode();
        String economicName = store.economicName(item.economicCode()).orElse(ClassificationPeriodRow.UNKNOWN_ECONOMIC_NAME);
        return Optional.of(new Selected(item.functionalCode(), functionalName.get(), economicCode, economicName, amount));
    }

    private boolean matches(BudgetSeed.LineItem item, AnalyticsFilter filter) {
        if (!filter.accountCategory().equals(item.accountCategory())) {
            return false;
        }
        if (filter.reportType() != null && !filter.reportType().equals(item.reportType())) {
            return false;
        }
        if (!filter.reportPeriod().includesYear(item.year())) {
            return false;
        }
        if (!filter.entityCuis().isEmpty() && !filter.entityCuis().contains(item.entityCui())) {
            return false;
        }
        if (!filter.functionalCodes().isEmpty() && !filter.functionalCodes().contains(item.functionalCode())) {
            return false;
        }
        if (!filter.functionalPrefixes().isEmpty() && !startsWithAny(item.functionalCode(), filter.functionalPrefixes())) {
            return false;
        }
        if (!filter.economicCodes().isEmpty() && (item.economicCode() == null || !filter.economicCodes().contains(item.economicCode()))) {
            return false;
        }
        if (!filter.economicPrefixes().isEmpty() && !startsWithAny(item.economicCode(), filter.economicPrefixes())) {
            return false;
        }
        if (isExcluded(item, filter)) {
            return false;
        }
        return matchesEntity(item, filter);
    }

    private static boolean withinItemBounds(BigDecimal amount, AnalyticsFilter filter) {
        if (filter.itemMinAmount() != null && amount.compareTo(filter.itemMinAmount()) < 0) {
            return false;
        }
        return filter.itemMaxAmount() == null || amount.compareTo(filter.itemMaxAmount()) <= 0;
    }

    private boolean isExcluded(BudgetSeed.LineItem item, AnalyticsFilter filter) {
        AnalyticsFilter.Exclusions exclude = filter.exclude();
        if (exclude.entityCuis().contains(item.entityCui())
                || exclude.functionalCodes().contains(item.functionalCode())
                || startsWithAny(item.functionalCode(), exclude.functionalPrefixes())) {
            return true;
        }
        if (filter.appliesEconomicExclusions()
                && (exclude.economicCodes().contains(item.economicCode())
                || startsWithAny(item.economicCode(), exclude.economicPrefixes()))) {
            return true;
        }
        if (exclude.entityTypes().isEmpty() && exclude.countyCodes().isEmpty()) {
            return false;
        }
        Optional<BudgetSeed.Entity> entity = store.entity(item.entityCui());
        if (entity.isEmpty()) {
            return false;
        }
        String entityType = entity.get().entityType();
        if (entityType != null && exclude.entityTypes().contains(entityType)) {
            return true;
        }
        return store.uat(entity.get().uatId())
                .map(uat -> exclude.countyCodes().contains(uat.countyCode()))
                .orElse(false);
    }

    private boolean matchesEntity(BudgetSeed.LineItem item, AnalyticsFilter filter) {
        boolean needsEntity = !filter.entityTypes().isEmpty() || filter.isUat() != null
                || !filter.uatIds().isEmpty() || !filter.countyCodes().isEmpty();
        if (!needsEntity) {
            return true;
        }
        Optional<BudgetSeed.Entity> entity = store.entity(item.entityCui());
        if (entity.isEmpty()) {
            return false;
        }
        BudgetSeed.Entity e = entity.get();
        if (!filter.entityTypes().isEmpty() && !filter.entityTypes().contains(e.entityType())) {
            return false;
        }
        if (filter.isUat() != null && filter.isUat() != e.isUat()) {
            return false;
        }
        if (!filter.uatIds().isEmpty() && (e.uatId() == null || !filter.uatIds().contains(e.uatId()))) {
            return false;
        }
        if (!filter.countyCodes().isEmpty()) {
            return store.uat(e.uatId())
                    .map(uat -> filter.countyCodes().contains(uat.countyCode()))
                    .orElse(false);
        }
        return true;
    }

    private static boolean startsWithAny(String code, List<String> prefixes) {
        if (code == null) {
            return false;
        }
        return prefixes.stream().anyMatch(code::startsWith);
    }

    private record GroupKey(String functionalCode, String economicCode, int year) {
    }

    private record Selected(String functionalCode, String functionalName, String economicCode, String economicName, BigDecimal amount) {
    }
}
