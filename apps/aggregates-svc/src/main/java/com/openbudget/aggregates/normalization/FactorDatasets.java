package com.openbudget.aggregates.normalization;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Sparse source values for one normalization dimension. Yearly values are required,
 * quarterly and monthly overrides are optional and may be empty.
 */
public record FactorDatasets(
        Map<String, BigDecimal> yearly,
        Map<String, BigDecimal> quarterly,
        Map<String, BigDecimal> monthly
) {
    public FactorDatasets {
        if (yearly == null) {
            throw new IllegalArgumentException("yearly factors must be provided");
        }
        quarterly = quarterly == null ? Map.of() : quarterly;
        monthly = monthly == null ? Map.of() : monthly;
    }

    public static FactorDatasets yearlyOnly(Map<String, BigDecimal> yearly) {
        return new FactorDatasets(yearly, Map.of(), Map.of());
    }
}
