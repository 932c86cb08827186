package com.openbudget.aggregates.normalization;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Period-keyed factors for every normalization dimension. Maps may be sparse.
 *
 * @param cpi        inflation factors ({@code CPI_ref / CPI_period}, reference period is 1)
 * @param eur        RON per EUR
 * @param usd        RON per USD
 * @param gdp        nominal GDP in RON
 * @param population yearly population series, the legacy per-capita denominator
 */
public record FactorBundle(
        Map<String, BigDecimal> cpi,
        Map<String, BigDecimal> eur,
        Map<String, BigDecimal> usd,
        Map<String, BigDecimal> gdp,
        Map<String, BigDecimal> population
) {
    public FactorBundle {
        cpi = cpi == null ? Map.of() : cpi;
        eur = eur == null ? Map.of() : eur;
        usd = usd == null ? Map.of() : usd;
        gdp = gdp == null ? Map.of() : gdp;
        population = population == null ? Map.of() : population;
    }

    public static FactorBundle empty() {
        return new FactorBundle(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    public Map<String, BigDecimal> exchangeRates(NormalizationConfig.Currency currency) {
        return switch (currency) {
            case EUR -> eur;
            case USD -> usd;
            case RON -> Map.of();
        };
    }
}
