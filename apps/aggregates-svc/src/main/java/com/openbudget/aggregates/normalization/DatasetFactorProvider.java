package com.openbudget.aggregates.normalization;

import com.openbudget.aggregates.dataset.Dataset;
import com.openbudget.aggregates.dataset.DatasetRepository;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Dataset-backed {@link FactorProvider}. Required datasets are validated and loaded once,
 * factor maps are generated per request at the requested frequency.
 */
@Service
public class DatasetFactorProvider implements FactorProvider {

    private static final Logger log = LoggerFactory.getLogger(DatasetFactorProvider.class);

    private final FactorMapGenerator generator;
    private final Map<NormalizationDatasetRegistry.Dimension, FactorDatasets> datasets;

    public DatasetFactorProvider(DatasetRepository datasetRepository, FactorMapGenerator generator) {
        this.generator = generator;
        validateRequiredDatasets(datasetRepository);
        this.datasets = loadDatasets(datasetRepository);
    }

    @Override
    public FactorBundle generateFactors(Frequency frequency, int startYear, int endYear) {
        log.debug("generate_factors frequency={} startYear={} endYear={}", frequency, startYear, endYear);
        return new FactorBundle(
                generate(NormalizationDatasetRegistry.Dimension.CPI, frequency, startYear, endYear),
                generate(NormalizationDatasetRegistry.Dimension.EUR, frequency, startYear, endYear),
                generate(NormalizationDatasetRegistry.Dimension.USD, frequency, startYear, endYear),
                generate(NormalizationDatasetRegistry.Dimension.GDP, frequency, startYear, endYear),
                generate(NormalizationDatasetRegistry.Dimension.POPULATION, frequency, startYear, endYear)
        );
    }

    private Map<String, BigDecimal> generate(NormalizationDatasetRegistry.Dimension dimension, Frequency frequency, int startYear, int endYear) {
        return generator.generate(frequency, startYear, endYear, datasets.get(dimension));
    }

    private void validateRequiredDatasets(DatasetRepository repository) {
        List<String> missing = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (String id : NormalizationDatasetRegistry.requiredDatasetIds()) {
            if (repository.findById(id).isEmpty()) {
                missing.add(id);
                errors.put(id, "dataset not found");
            }
        }
        if (!missing.isEmpty()) {
            throw new NormalizationDatasetException(missing, errors);
        }
    }

    private Map<NormalizationDatasetRegistry.Dimension, FactorDatasets> loadDatasets(DatasetRepository repository) {
        Map<NormalizationDatasetRegistry.Dimension, FactorDatasets> loaded = new EnumMap<>(NormalizationDatasetRegistry.Dimension.class);
        for (NormalizationDatasetRegistry.Dimension dimension : NormalizationDatasetRegistry.Dimension.values()) {
            NormalizationDatasetRegistry.DimensionDatasets ids = NormalizationDatasetRegistry.datasetsFor(dimension);
            loaded.put(dimension, new FactorDatasets(
                    load(repository, ids.yearly()),
                    load(repository, ids.quarterly()),
                    load(repository, ids.monthly())
            ));
        }
        log.info("normalization_datasets_loaded dimensions={}", loaded.keySet());
        return loaded;
    }

    private Map<String, BigDecimal> load(DatasetRepository repository, String id) {
        if (id == null) {
            return Map.of();
        }
        return repository.findById(id)
                .map(Dataset::toFactorMap)
                .orElseGet(() -> {
                    log.warn("normalization_dataset_missing id={}", id);
                    return Map.of();
                });
    }
}
