package com.openbudget.aggregates.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openbudget.aggregates.population.InMemoryPopulationRepository;
import com.openbudget.aggregates.population.JdbcPopulationRepository;
import com.openbudget.aggregates.repository.BudgetSeed;
import com.openbudget.aggregates.repository.InMemoryBudgetStore;
import com.openbudget.aggregates.repository.InMemoryLineItemRepository;
import com.openbudget.aggregates.repository.JdbcLineItemRepository;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Selects the line item and population adapters from {@code aggregates.repository}.
 */
public class RepositoryConfig {

    private static final Logger log = LoggerFactory.getLogger(RepositoryConfig.class);

    private RepositoryConfig() {
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "aggregates.repository", havingValue = "memory", matchIfMissing = true)
    public static class InMemoryRepositories {

        @Bean
        public InMemoryBudgetStore inMemoryBudgetStore(ObjectMapper objectMapper, ResourceLoader resourceLoader, AggregatesProperties properties) {
            Resource resource = resourceLoader.getResource(properties.seedLocation());
            try (InputStream in = resource.getInputStream()) {
                BudgetSeed seed = objectMapper.readValue(in, BudgetSeed.class);
                log.info("budget_seed_loaded location={} lineItems={} entities={} uats={}",
                        properties.seedLocation(), seed.lineItems().size(), seed.entities().size(), seed.uats().size());
                return new InMemoryBudgetStore(seed);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read budget seed " + properties.seedLocation(), ex);
            }
        }

        @Bean
        public InMemoryLineItemRepository inMemoryLineItemRepository(InMemoryBudgetStore store) {
            return new InMemoryLineItemRepository(store);
        }

        @Bean
        public InMemoryPopulationRepository inMemoryPopulationRepository(InMemoryBudgetStore store) {
            return new InMemoryPopulationRepository(store);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "aggregates.repository", havingValue = "jdbc")
    public static class JdbcRepositories {

        @Bean
        public JdbcLineItemRepository jdbcLineItemRepository(DataSource dataSource, AggregatesProperties properties) {
            log.info("line_item_repository type=jdbc queryTimeoutSeconds={}", properties.queryTimeoutSeconds());
            return new JdbcLineItemRepository(dataSource, properties.queryTimeoutSeconds());
        }

        @Bean
        public JdbcPopulationRepository jdbcPopulationRepository(DataSource dataSource, AggregatesProperties properties) {
            return new JdbcPopulationRepository(dataSource, properties.queryTimeoutSeconds());
        }
    }
}
