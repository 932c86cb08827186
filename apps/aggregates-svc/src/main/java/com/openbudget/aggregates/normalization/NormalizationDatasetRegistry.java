package com.openbudget.aggregates.normalization;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dataset ids backing each normalization dimension. Only the yearly series are required;
 * quarterly and monthly series are used when registered.
 */
public final class NormalizationDatasetRegistry {

    public enum Dimension {
        CPI,
        EUR,
        USD,
        GDP,
        POPULATION
    }

    public record DimensionDatasets(String yearly, String quarterly, String monthly) {
        public DimensionDatasets {
            if (yearly == null || yearly.isBlank()) {
                throw new IllegalArgumentException("yearly dataset id must be provided");
            }
        }

        public static DimensionDatasets yearlyOnly(String yearly) {
            return new DimensionDatasets(yearly, null, null);
        }
    }

    private static final Map<Dimension, DimensionDatasets> DATASETS = new EnumMap<>(Map.of(
            Dimension.CPI, DimensionDatasets.yearlyOnly("ro.economics.cpi.yearly"),
            Dimension.EUR, DimensionDatasets.yearlyOnly("ro.economics.exchange.ron_eur.yearly"),
            Dimension.USD, DimensionDatasets.yearlyOnly("ro.economics.exchange.ron_usd.yearly"),
            Dimension.GDP, DimensionDatasets.yearlyOnly("ro.economics.gdp.yearly"),
            Dimension.POPULATION, DimensionDatasets.yearlyOnly("ro.demographics.population.yearly")
    ));

    private NormalizationDatasetRegistry() {
    }

    public static DimensionDatasets datasetsFor(Dimension dimension) {
        return DATASETS.get(dimension);
    }

    public static List<String> requiredDatasetIds() {
        List<String> ids = new ArrayList<>();
        for (Dimension dimension : Dimension.values()) {
            ids.add(DATASETS.get(dimension).yearly());
        }
        return ids;
    }
}
