package com.openbudget.aggregates.normalization;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Builds a gap-free factor map at a target frequency from sparse source datasets.
 *
 * <p>Each period resolves to, in order: the value at the target frequency, the yearly value
 * for that period's year, or the last value resolved before it. CPI and exchange rates do not
 * reset between observations, so carrying a value forward is closer to the truth than
 * defaulting to one. The value carried into the first period is the latest source entry
 * strictly before {@code startYear}. Periods that still have no value are left out of the map.
 */
@Component
public class FactorMapGenerator {

    public Map<String, BigDecimal> generate(Frequency frequency, int startYear, int endYear, FactorDatasets datasets) {
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        if (endYear < startYear) {
            return result;
        }
        Map<String, BigDecimal> targetValues = switch (frequency) {
            case MONTH -> datasets.monthly();
            case QUARTER -> datasets.quarterly();
            case YEAR -> datasets.yearly();
        };

        BigDecimal previous = seedBefore(frequency, startYear, datasets);
        for (String label : PeriodLabels.generate(startYear, endYear, frequency)) {
            BigDecimal value = targetValues.get(label);
            if (value == null && frequency != Frequency.YEAR) {
                value = PeriodLabels.extractYear(label)
                        .stream()
                        .mapToObj(year -> datasets.yearly().get(PeriodLabels.yearLabel(year)))
                        .findFirst()
                        .orElse(null);
            }
            if (value == null) {
                value = previous;
            }
            if (value != null) {
                result.put(label, value);
                previous = value;
            }
        }
        return result;
    }

    private BigDecimal seedBefore(Frequency frequency, int startYear, FactorDatasets datasets) {
        BigDecimal seed = switch (frequency) {
            case MONTH -> latestBefore(datasets.monthly(), PeriodLabels::monthIndex, startYear * 12 + 1);
            case QUARTER -> latestBefore(datasets.quarterly(), PeriodLabels::quarterIndex, startYear * 4 + 1);
            case YEAR -> null;
        };
        if (seed == null) {
            seed = latestBefore(datasets.yearly(), PeriodLabels::yearIndex, startYear);
        }
        return seed;
    }

    // Full scan: source maps carry no ordering guarantee.
    private BigDecimal latestBefore(Map<String, BigDecimal> values, Function<String, OptionalInt> indexer, int boundary) {
        Integer latestIndex = null;
        BigDecimal latestValue = null;
        for (Map.Entry<String, BigDecimal> entry : values.entrySet()) {
            OptionalInt index = indexer.apply(entry.getKey());
            if (index.isEmpty() || index.getAsInt() >= boundary) {
                continue;
            }
            if (latestIndex == null || index.getAsInt() > latestIndex) {
                latestIndex = index.getAsInt();
                latestValue = entry.getValue();
            }
        }
        return latestValue;
    }
}
