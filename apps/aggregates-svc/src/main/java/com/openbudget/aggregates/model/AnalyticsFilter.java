package com.openbudget.aggregates.model;

import com.openbudget.aggregates.normalization.NormalizationConfig;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dimensional filter, normalization request and aggregate thresholds for one query.
 * List filters are never null; an empty list means "not filtered".
 *
 * <p>{@code itemMinAmount}/{@code itemMaxAmount} bound each line item's raw amount at the report
 * frequency before grouping, while {@code aggregateMinAmount}/{@code aggregateMaxAmount} bound the
 * normalized group total.
 */
public record AnalyticsFilter(
        String accountCategory,
        ReportPeriod reportPeriod,
        String reportType,
        List<String> entityCuis,
        List<Long> uatIds,
        List<String> countyCodes,
        List<String> entityTypes,
        Boolean isUat,
        List<String> functionalCodes,
        List<String> functionalPrefixes,
        List<String> economicCodes,
        List<String> economicPrefixes,
        Exclusions exclude,
        BigDecimal itemMinAmount,
        BigDecimal itemMaxAmount,
        BigDecimal aggregateMinAmount,
        BigDecimal aggregateMaxAmount,
        NormalizationConfig normalization
) {
    public AnalyticsFilter {
        if (accountCategory == null || accountCategory.isBlank()) {
            throw new IllegalArgumentException("accountCategory must be provided");
        }
        if (reportPeriod == null) {
            throw new IllegalArgumentException("reportPeriod must be provided");
        }
        entityCuis = copy(entityCuis);
        uatIds = copy(uatIds);
        countyCodes = copy(countyCodes);
        entityTypes = copy(entityTypes);
        functionalCodes = copy(functionalCodes);
        functionalPrefixes = copy(functionalPrefixes);
        economicCodes = copy(economicCodes);
        economicPrefixes = copy(economicPrefixes);
        exclude = exclude == null ? Exclusions.NONE : exclude;
        normalization = normalization == null ? NormalizationConfig.NONE : normalization;
    }

    /** Income accounts carry no economic classification worth excluding on. */
    public static final String INCOME_ACCOUNT_CATEGORY = "vn";

    /**
     * Rows matching any listed value are dropped. Rows with no value for an excluded dimension
     * (no economic code, no entity, no UAT) are kept.
     */
    public record Exclusions(
            List<String> entityCuis,
            List<String> functionalCodes,
            List<String> functionalPrefixes,
            List<String> economicCodes,
            List<String> economicPrefixes,
            List<String> entityTypes,
            List<String> countyCodes
    ) {
        public static final Exclusions NONE = new Exclusions(null, null, null, null, null, null, null);

        public Exclusions {
            entityCuis = copy(entityCuis);
            functionalCodes = copy(functionalCodes);
            functionalPrefixes = copy(functionalPrefixes);
            economicCodes = copy(economicCodes);
            economicPrefixes = copy(economicPrefixes);
            entityTypes = copy(entityTypes);
            countyCodes = copy(countyCodes);
        }
    }

    /**
     * Economic exclusions are ignored for income accounts.
     */
    public boolean appliesEconomicExclusions() {
        return !INCOME_ACCOUNT_CATEGORY.equals(accountCategory);
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * True when an entity, UAT, county or entity-type constraint narrows the population the query covers.
     */
    public boolean narrowsPopulation() {
        return !entityCuis.isEmpty()
                || !uatIds.isEmpty()
                || !countyCodes.isEmpty()
                || !entityTypes.isEmpty()
                || Boolean.TRUE.equals(isUat);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String accountCategory;
        private ReportPeriod reportPeriod;
        private String reportType;
        private List<String> entityCuis;
        private List<Long> uatIds;
        private List<String> countyCodes;
        private List<String> entityTypes;
        private Boolean isUat;
        private List<String> functionalCodes;
        private List<String> functionalPrefixes;
        private List<String> economicCodes;
        private List<String> economicPrefixes;
        private Exclusions exclude;
        private BigDecimal itemMinAmount;
        private BigDecimal itemMaxAmount;
        private BigDecimal aggregateMinAmount;
        private BigDecimal aggregateMaxAmount;
        private NormalizationConfig normalization;

        public Builder accountCategory(String accountCategory) {
            this.accountCategory = accountCategory;
            return this;
        }

        public Builder reportPeriod(ReportPeriod reportPeriod) {
            this.reportPeriod = reportPeriod;
            return this;
        }

        public Builder reportType(String reportType) {
            this.reportType = reportType;
            return this;
        }

        public Builder entityCuis(List<String> entityCuis) {
            this.entityCuis = entityCuis;
            return this;
        }

        public Builder uatIds(List<Long> uatIds) {
            this.uatIds = uatIds;
            return this;
        }

        public Builder countyCodes(List<String> countyCodes) {
            this.countyCodes = countyCodes;
            return this;
        }

        public Builder entityTypes(List<String> entityTypes) {
            this.entityTypes = entityTypes;
            return this;
        }

        public Builder isUat(Boolean isUat) {
            this.isUat = isUat;
            return this;
        }

        public Builder functionalCodes(List<String> functionalCodes) {
            this.functionalCodes = functionalCodes;
            return this;
        }

        public Builder functionalPrefixes(List<String> functionalPrefixes) {
            this.functionalPrefixes = functionalPrefixes;
            return this;
        }

        public Builder economicCodes(List<String> economicCodes) {
            this.economicCodes = economicCodes;
            return this;
        }

        public Builder economicPrefixes(List<String> economicPrefixes) {
            this.economicPrefixes = economicPrefixes;
            return this;
        }

        public Builder exclude(Exclusions exclude) {
            this.exclude = exclude;
            return this;
        }

        public Builder itemMinAmount(BigDecimal itemMinAmount) {
            this.itemMinAmount = itemMinAmount;
            return this;
        }

        public Builder itemMaxAmount(BigDecimal itemMaxAmount) {
            this.itemMaxAmount = itemMaxAmount;
            return this;
        }

        public Builder aggregateMinAmount(BigDecimal aggregateMinAmount) {
            this.aggregateMinAmount = aggregateMinAmount;
            return this;
        }

        public Builder aggregateMaxAmount(BigDecimal aggregateMaxAmount) {
            this.aggregateMaxAmount = aggregateMaxAmount;
            return this;
        }

        public Builder normalization(NormalizationConfig normalization) {
            this.normalization = normalization;
            return this;
        }

        public AnalyticsFilter build() {
            return new AnalyticsFilter(
                    accountCategory,
                    reportPeriod,
                    reportType,
                    entityCuis,
                    uatIds,
                    countyCodes,
                    entityTypes,
                    isUat,
                    functionalCodes,
                    functionalPrefixes,
                    economicCodes,
                    economicPrefixes,
                    exclude,
                    itemMinAmount,
                    itemMaxAmount,
                    aggregateMinAmount,
                    aggregateMaxAmount,
                    normalization
            );
        }
    }
}
