package com.openbudget.aggregates.normalization;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Folds the active normalization transforms into one multiplier per period.
 *
 * <p>Percent-of-GDP is exclusive: {@code 100 / gdp}, or zero when GDP is missing or zero.
 * Otherwise the multiplier starts at one and applies, in this order, inflation
 * ({@code * cpi}), currency ({@code / rate}) and per-capita ({@code / population}). Inflation and
 * currency are both nominal-RON based, so per-capita scaling must come last. A missing or zero
 * CPI or exchange rate leaves the multiplier unchanged.
 */
@Component
public class MultiplierCompositor {

    static final MathContext PRECISION = MathContext.DECIMAL128;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @param populationDenominator filter-based population, constant for every period; {@code null}
     *                              falls back to the bundle's yearly population series
     */
    public Map<String, BigDecimal> compose(
            NormalizationConfig config,
            FactorBundle factors,
            List<String> periodLabels,
            BigDecimal populationDenominator
    ) {
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        for (String label : periodLabels) {
            result.put(label, multiplierFor(config, factors, label, populationDenominator));
        }
        return result;
    }

    public BigDecimal multiplierFor(
            NormalizationConfig config,
            FactorBundle factors,
            String periodLabel,
            BigDecimal populationDenominator
    ) {
        if (config.mode() == NormalizationConfig.Mode.PERCENT_GDP) {
            BigDecimal gdp = factors.gdp().get(periodLabel);
            if (!usable(gdp)) {
                return BigDecimal.ZERO;
            }
            return HUNDRED.divide(gdp, PRECISION);
        }

        BigDecimal multiplier = BigDecimal.ONE;
        if (config.inflationAdjusted()) {
            BigDecimal cpi = factors.cpi().get(periodLabel);
            if (usable(cpi)) {
                multiplier = multiplier.multiply(cpi, PRECISION);
            }
        }
        if (config.currency() != NormalizationConfig.Currency.RON) {
            BigDecimal rate = factors.exchangeRates(config.currency()).get(periodLabel);
            if (usable(rate)) {
                multiplier = multiplier.divide(rate, PRECISION);
            }
        }
        if (config.mode() == NormalizationConfig.Mode.PER_CAPITA) {
            BigDecimal population = populationDenominator != null
                    ? populationDenominator
                    : factors.population().get(periodLabel);
            if (usable(population)) {
                multiplier = multiplier.divide(population, PRECISION);
            }
        }
        return multiplier;
    }

    private static boolean usable(BigDecimal factor) {
        return factor != null && factor.signum() != 0;
    }
}
