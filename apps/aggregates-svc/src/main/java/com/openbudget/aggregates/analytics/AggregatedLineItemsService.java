package com.openbudget.aggregates.analytics;

import com.openbudget.aggregates.config.AggregatesProperties;
import com.openbudget.aggregates.model.AggregatedClassification;
import com.openbudget.aggregates.model.AggregatedLineItem;
import com.openbudget.aggregates.model.AggregatedLineItemConnection;
import com.openbudget.aggregates.model.AnalyticsFilter;
import com.openbudget.aggregates.model.ClassificationKey;
import com.openbudget.aggregates.model.ClassificationPeriodRow;
import com.openbudget.aggregates.model.ReportPeriod;
import com.openbudget.aggregates.normalization.FactorBundle;
import com.openbudget.aggregates.normalization.FactorProvider;
import com.openbudget.aggregates.normalization.Frequency;
import com.openbudget.aggregates.normalization.MultiplierCompositor;
import com.openbudget.aggregates.normalization.NormalizationConfig;
import com.openbudget.aggregates.normalization.PeriodLabels;
import com.openbudget.aggregates.population.PopulationDenominatorResolver;
import com.openbudget.aggregates.repository.AggregateFilters;
import com.openbudget.aggregates.repository.ClassificationPeriodRepository;
import com.openbudget.aggregates.repository.NormalizedAggregateRepository;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Aggregates execution line items by functional and economic classification. Every row is
 * normalized with the factors of its own year before amounts are summed, so a total spanning
 * several years never mixes exchange rates or price levels.
 */
@Service
public class AggregatedLineItemsService {

    private static final Logger log = LoggerFactory.getLogger(AggregatedLineItemsService.class);

    private final ClassificationPeriodRepository classificationPeriodRepository;
    private final NormalizedAggregateRepository normalizedAggregateRepository;
    private final FactorProvider factorProvider;
    private final MultiplierCompositor multiplierCompositor;
    private final PopulationDenominatorResolver populationDenominatorResolver;
    private final AggregatesProperties properties;

    public AggregatedLineItemsService(
            ClassificationPeriodRepository classificationPeriodRepository,
            NormalizedAggregateRepository normalizedAggregateRepository,
            FactorProvider factorProvider,
            MultiplierCompositor multiplierCompositor,
            PopulationDenominatorResolver populationDenominatorResolver,
            AggregatesProperties properties
    ) {
        this.classificationPeriodRepository = classificationPeriodRepository;
        this.normalizedAggregateRepository = normalizedAggregateRepository;
        this.factorProvider = factorProvider;
        this.multiplierCompositor = multiplierCompositor;
        this.populationDenominatorResolver = populationDenominatorResolver;
        this.properties = properties;
    }

    public AggregationResult<AggregatedLineItemConnection> getAggregatedLineItems(AnalyticsFilter filter, Integer limit, Integer offset) {
        int pageLimit = clampLimit(limit);
        int pageOffset = offset == null ? 0 : Math.max(0, offset);
        ExecutionStrategy strategy = properties.strategy();
        AggregationResult<AggregatedLineItemConnection> result = strategy == ExecutionStrategy.IN_MEMORY
                ? aggregateInMemory(filter, pageLimit, pageOffset)
                : aggregateInStore(filter, pageLimit, pageOffset);
        if (result.isOk()) {
            log.info("aggregated_line_items strategy={} normalization={} currency={} inflationAdjusted={} limit={} offset={} totalCount={}",
                    strategy,
                    filter.normalization().mode(),
                    filter.normalization().currency(),
                    filter.normalization().inflationAdjusted(),
                    pageLimit,
                    pageOffset,
                    result.value().pageInfo().totalCount());
        } else {
            log.warn("aggregated_line_items_failed strategy={} kind={} retryable={} message={}",
                    strategy, result.error().kind(), result.error().retryable(), result.error().message());
        }
        return result;
    }

    private AggregationResult<AggregatedLineItemConnection> aggregateInMemory(AnalyticsFilter filter, int limit, int offset) {
        AggregationResult<List<ClassificationPeriodRow>> fetched = classificationPeriodRepository.getClassificationPeriodData(filter);
        if (!fetched.isOk()) {
            return AggregationResult.failure(fetched.error());
        }
        List<ClassificationPeriodRow> rows = fetched.value();
        if (rows.isEmpty()) {
            return AggregationResult.ok(AggregatedLineItemConnection.empty(offset));
        }

        NormalizationConfig config = filter.normalization();
        FactorBundle factors = FactorBundle.empty();
        BigDecimal denominator = null;
        if (config.requiresTransform()) {
            int minYear = rows.stream().mapToInt(ClassificationPeriodRow::year).min().getAsInt();
            int maxYear = rows.stream().mapToInt(ClassificationPeriodRow::year).max().getAsInt();
            AggregationResult<FactorBundle> loaded = loadFactors(minYear, maxYear);
            if (!loaded.isOk()) {
                return AggregationResult.failure(loaded.error());
            }
            factors = loaded.value();
            denominator = denominatorFor(filter);
        }

        Map<String, BigDecimal> multipliers = new HashMap<>();
        Map<ClassificationKey, AggregatedClassification> aggregated = new LinkedHashMap<>();
        for (ClassificationPeriodRow row : rows) {
            BigDecimal normalizedAmount = row.amount();
            if (config.requiresTransform()) {
                String label = PeriodLabels.yearLabel(row.year());
                FactorBundle bundle = factors;
                BigDecimal den = denominator;
                BigDecimal multiplier = multipliers.computeIfAbsent(label,
                        key -> multiplierCompositor.multiplierFor(config, bundle, key, den));
                normalizedAmount = normalizedAmount.multiply(multiplier);
            }
            AggregatedClassification existing = aggregated.get(row.key());
            if (existing == null) {
                aggregated.put(row.key(), AggregatedClassification.startFrom(row, normalizedAmount));
            } else {
                existing.add(normalizedAmount, row.count());
            }
        }

        AggregateFilters thresholds = AggregateFilters.from(filter);
        List<AggregatedClassification> sorted = aggregated.values().stream()
                .filter(item -> thresholds.matches(item.amount()))
                .sorted(AggregatedClassification.BY_AMOUNT_DESC)
                .toList();
        int from = Math.min(offset, sorted.size());
        int to = (int) Math.min((long) offset + limit, sorted.size());
        List<AggregatedLineItem> nodes = sorted.subList(from, to).stream()
                .map(AggregatedClassification::toLineItem)
                .toList();
        log.debug("aggregated_line_items_in_memory rows={} groups={} filtered={}", rows.size(), aggregated.size(), sorted.size());
        return AggregationResult.ok(new AggregatedLineItemConnection(
                nodes,
                AggregatedLineItemConnection.PageInfo.of(sorted.size(), limit, offset)));
    }

    private AggregationResult<AggregatedLineItemConnection> aggregateInStore(AnalyticsFilter filter, int limit, int offset) {
        ReportPeriod.YearRange range = filter.reportPeriod().yearRange();
        List<String> labels = PeriodLabels.generate(range.startYear(), range.endYear(), Frequency.YEAR);
        NormalizationConfig config = filter.normalization();

        Map<String, BigDecimal> factorMap;
        if (config.requiresTransform()) {
            AggregationResult<FactorBundle> loaded = loadFactors(range.startYear(), range.endYear());
            if (!loaded.isOk()) {
                return AggregationResult.failure(loaded.error());
            }
            factorMap = multiplierCompositor.compose(config, loaded.value(), labels, denominatorFor(filter));
        } else {
            factorMap = new LinkedHashMap<>();
            for (String label : labels) {
                factorMap.put(label, BigDecimal.ONE);
            }
        }

        AggregationResult<NormalizedAggregateRepository.NormalizedAggregatedResult> fetched =
                normalizedAggregateRepository.getNormalizedAggregatedItems(
                        filter,
                        factorMap,
                        new NormalizedAggregateRepository.Pagination(limit, offset),
                        AggregateFilters.from(filter));
        return fetched.map(result -> new AggregatedLineItemConnection(
                result.items().stream().map(AggregatedClassification::toLineItem).toList(),
                AggregatedLineItemConnection.PageInfo.of(result.totalCount(), limit, offset)));
    }

    private AggregationResult<FactorBundle> loadFactors(int startYear, int endYear) {
        try {
            return AggregationResult.ok(factorProvider.generateFactors(Frequency.YEAR, startYear, endYear));
        } catch (RuntimeException ex) {
            String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            return AggregationResult.failure(AggregationError.normalizationData("Normalization data unavailable: " + reason, ex));
        }
    }

    private BigDecimal denominatorFor(AnalyticsFilter filter) {
        if (filter.normalization().mode() != NormalizationConfig.Mode.PER_CAPITA) {
            return null;
        }
        return populationDenominatorResolver.resolve(filter).orElse(null);
    }

    private int clampLimit(Integer limit) {
        AggregatesProperties.Pagination pagination = properties.pagination();
        int requested = limit == null ? pagination.defaultLimit() : limit;
        return Math.max(0, Math.min(requested, pagination.maxLimit()));
    }
}
