package com.openbudget.aggregates.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openbudget.aggregates.config.AggregatesProperties;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Repository;

/**
 * Reads normalization datasets from JSON files matched by {@code aggregates.dataset-location}.
 * Files are parsed once at startup.
 */
@Repository
public class ClasspathDatasetRepository implements DatasetRepository {

    private static final Logger log = LoggerFactory.getLogger(ClasspathDatasetRepository.class);

    private final Map<String, Dataset> datasets = new ConcurrentHashMap<>();

    @Autowired
    public ClasspathDatasetRepository(ObjectMapper objectMapper, AggregatesProperties properties) {
        this(objectMapper, properties.datasetLocation(), new PathMatchingResourcePatternResolver());
    }

    ClasspathDatasetRepository(ObjectMapper objectMapper, String location, ResourcePatternResolver resolver) {
        Resource[] resources;
        try {
            resources = resolver.getResources(location);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list datasets at " + location, ex);
        }
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                Dataset dataset = objectMapper.readValue(in, Dataset.class);
                datasets.put(dataset.id(), dataset);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read dataset " + resource.getDescription(), ex);
            }
        }
        log.info("datasets_loaded location={} count={}", location, datasets.size());
    }

    @Override
    public Optional<Dataset> findById(String id) {
        return Optional.ofNullable(datasets.get(id));
    }
}
