package com.openbudget.aggregates.config;

import com.openbudget.aggregates.analytics.ExecutionStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "aggregates")
public record AggregatesProperties(
        ExecutionStrategy strategy,
        RepositoryType repository,
        Pagination pagination,
        Integer queryTimeoutSeconds,
        String datasetLocation,
        String seedLocation
) {

    public static final String DEFAULT_DATASET_LOCATION = "classpath:datasets/*.json";
    public static final String DEFAULT_SEED_LOCATION = "classpath:seed/budget-seed.json";

    @ConstructorBinding
    public AggregatesProperties {
        strategy = strategy == null ? ExecutionStrategy.STORE_DELEGATED : strategy;
        repository = repository == null ? RepositoryType.MEMORY : repository;
        pagination = pagination == null ? Pagination.DEFAULT : pagination;
        if (queryTimeoutSeconds == null) {
            queryTimeoutSeconds = 15;
        }
        if (queryTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("queryTimeoutSeconds must be positive");
        }
        if (datasetLocation == null || datasetLocation.isBlank()) {
            datasetLocation = DEFAULT_DATASET_LOCATION;
        }
        if (seedLocation == null || seedLocation.isBlank()) {
            seedLocation = DEFAULT_SEED_LOCATION;
        }
    }

    public enum RepositoryType {
        MEMORY,
        JDBC
    }

    public record Pagination(Integer defaultLimit, Integer maxLimit) {

        public static final int DEFAULT_LIMIT = 50;
        public static final int MAX_LIMIT = 1000;
        static final Pagination DEFAULT = new Pagination(DEFAULT_LIMIT, MAX_LIMIT);

        public Pagination {
            if (defaultLimit == null) {
                defaultLimit = DEFAULT_LIMIT;
            }
            if (maxLimit == null) {
                maxLimit = MAX_LIMIT;
            }
            if (maxLimit < 0) {
                throw new IllegalArgumentException("pagination.maxLimit must not be negative");
            }
            if (defaultLimit < 0 || defaultLimit > maxLimit) {
                throw new IllegalArgumentException("pagination.defaultLimit must be between 0 and maxLimit");
            }
        }
    }
}
