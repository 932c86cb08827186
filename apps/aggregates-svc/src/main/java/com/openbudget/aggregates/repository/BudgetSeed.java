package com.openbudget.aggregates.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.openbudget.aggregates.normalization.Frequency;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Reference data and execution line items backing the in-memory store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BudgetSeed(
        List<Uat> uats,
        List<Entity> entities,
        Map<String, String> functionalClassifications,
        Map<String, String> economicClassifications,
        List<LineItem> lineItems
) {
    public BudgetSeed {
        uats = uats == null ? List.of() : List.copyOf(uats);
        entities = entities == null ? List.of() : List.copyOf(entities);
        functionalClassifications = functionalClassifications == null ? Map.of() : Map.copyOf(functionalClassifications);
        economicClassifications = economicClassifications == null ? Map.of() : Map.copyOf(economicClassifications);
        lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    }

    /**
     * Administrative-territorial unit. County-level units carry {@code sirutaCode == countyCode}.
     */
    public record Uat(long id, String sirutaCode, String countyCode, String name, BigDecimal population) {
    }

    public record Entity(String cui, String name, String entityType, Long uatId, @JsonProperty("isUat") boolean isUat) {
    }

    public record LineItem(
            String entityCui,
            String accountCategory,
            String reportType,
            int year,
            String functionalCode,
            String economicCode,
            BigDecimal ytdAmount,
            BigDecimal quarterlyAmount,
            BigDecimal monthlyAmount,
            boolean yearly,
            boolean quarterly
    ) {
        /**
         * Amount reported for the frequency, or {@code null} when the item does not report at it.
         * A reporting item without an amount counts as zero.
         */
        public BigDecimal amountFor(Frequency frequency) {
            return switch (frequency) {
                case MONTH -> orZero(monthlyAmount);
                case QUARTER -> quarterly ? orZero(quarterlyAmount) : null;
                case YEAR -> yearly ? orZero(ytdAmount) : null;
            };
        }

        private static BigDecimal orZero(BigDecimal amount) {
            return amount == null ? BigDecimal.ZERO : amount;
        }
    }
}
