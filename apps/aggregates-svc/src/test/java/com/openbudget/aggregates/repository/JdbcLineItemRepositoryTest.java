package com.openbudget.aggregates.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.openbudget.aggregates.analytics.AggregationError;
import com.openbudget.aggregates.analytics.AggregationResult;
import com.openbudget.aggregates.model.AggregatedClassification;
import com.openbudget.aggregates.model.AnalyticsFilter;
import com.openbudget.aggregates.model.ClassificationPeriodRow;
import com.openbudget.aggregates.model.ReportPeriod;
import com.openbudget.aggregates.normalization.Frequency;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

class JdbcLineItemRepositoryTest {

    private JdbcDataSource dataSource;
    private JdbcLineItemRepository repository;

    @BeforeEach
    void setUp() {
        dataSource = dataSource();
        new ResourceDatabasePopulator(
                new ClassPathResource("db/schema.sql"),
                new ClassPathResource("db/line-items-data.sql")
        ).execute(dataSource);
        repository = new JdbcLineItemRepository(dataSource, 5);
    }

    @Test
    void groupsRowsByClassificationAndYear() {
        List<ClassificationPeriodRow> rows = repository.getClassificationPeriodData(filter().build()).value();

        assertThat(rows).hasSize(5);
        assertThat(rows)
                .filteredOn(row -> row.functionalCode().equals("65.02") && row.year() == 2024)
                .singleElement()
                .satisfies(row -> {
                    assertThat(row.amount()).isEqualByComparingTo("600");
                    assertThat(row.functionalName()).isEqualTo("Invatamant");
                    assertThat(row.count()).isEqualTo(1);
                });
    }

    @Test
    void missingEconomicClassificationFallsBackToUnknown() {
        List<ClassificationPeriodRow> rows = repository.getClassificationPeriodData(filter().build()).value();

        assertThat(rows)
                .filteredOn(row -> row.functionalCode().equals("84.02") && row.year() == 2024)
                .singleElement()
                .satisfies(row -> {
                    assertThat(row.economicCode()).isEqualTo(ClassificationPeriodRow.UNKNOWN_ECONOMIC_CODE);
                    assertThat(row.economicName()).isEqualTo(ClassificationPeriodRow.UNKNOWN_ECONOMIC_NAME);
                });
    }

    @Test
    void quarterlyPeriodsOnlyReadQuarterlyItems() {
        AnalyticsFilter filter = filter()
                .reportPeriod(new ReportPeriod(Frequency.QUARTER, new ReportPeriod.Interval("2023-Q1", "2024-Q4"), List.of()))
                .build();

        List<ClassificationPeriodRow> rows = repository.getClassificationPeriodData(filter).value();

        assertThat(rows).hasSize(4);
        assertThat(rows)
                .filteredOn(row -> row.functionalCode().equals("65.02") && row.year() == 2023)
                .singleElement()
                .satisfies(row -> assertThat(row.amount()).isEqualByComparingTo("125"));
    }

    @Test
    void entityAndClassificationFiltersNarrowTheRows() {
        assertThat(repository.getClassificationPeriodData(filter().entityTypes(List.of("admin_county_council")).build()).value())
                .extracting(ClassificationPeriodRow::functionalCode)
                .containsExactly("51.02");
        assertThat(repository.getClassificationPeriodData(filter().countyCodes(List.of("B")).build()).value())
                .extracting(ClassificationPeriodRow::functionalCode)
                .containsOnly("84.02");
        assertThat(repository.getClassificationPeriodData(filter().functionalPrefixes(List.of("65")).build()).value())
                .extracting(ClassificationPeriodRow::year)
                .containsExactlyInAnyOrder(2023, 2024);
        assertThat(repository.getClassificationPeriodData(filter().economicCodes(List.of("10.01.01")).isUat(true).build()).value())
                .extracting(ClassificationPeriodRow::functionalCode)
                .containsOnly("65.02");
    }

    @Test
    void exclusionsRemoveMatchingRows() {
        assertThat(rows(filter().exclude(exclusions().economicCodes(List.of("10.01.01")).build())))
                .extracting(ClassificationPeriodRow::functionalCode)
                .containsExactlyInAnyOrder("84.02", "84.02");
        assertThat(rows(filter().exclude(exclusions().functionalPrefixes(List.of("8")).build())))
                .extracting(ClassificationPeriodRow::functionalCode)
                .containsExactlyInAnyOrder("65.02", "65.02", "51.02");
        assertThat(rows(filter().exclude(exclusions().entityTypes(List.of("admin_municipality")).build())))
                .extracting(ClassificationPeriodRow::functionalCode)
                .containsExactly("51.02");
        assertThat(rows(filter().exclude(exclusions().countyCodes(List.of("CJ")).build())))
                .extracting(ClassificationPeriodRow::functionalCode)
                .containsOnly("84.02");
        assertThat(rows(filter().exclude(exclusions().entityCuis(List.of("300")).functionalCodes(List.of("51.02")).build())))
                .extracting(ClassificationPeriodRow::functionalCode)
                .containsOnly("65.02");
    }

    @Test
    void economicExclusionsAreIgnoredForIncomeAccounts() {
        AnalyticsFilter filter = filter()
                .accountCategory("vn")
                .exclude(exclusions().economicCodes(List.of("10.01.01")).economicPrefixes(List.of("10")).build())
                .build();

        assertThat(rows(filter)).singleElement()
                .satisfies(row -> assertThat(row.amount()).isEqualByComparingTo("5000"));
    }

    @Test
    void itemBoundsFilterIndividualAmounts() {
        List<ClassificationPeriodRow> rows = rows(filter()
                .itemMinAmount(new BigDecimal("300"))
                .itemMaxAmount(new BigDecimal("600")));

        assertThat(rows).extracting(ClassificationPeriodRow::amount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactlyInAnyOrder(new BigDecimal("500"), new BigDecimal("600"), new BigDecimal("300"));
    }

    @Test
    void rowCapKeepsTheEarliestRowsInCodeOrder() {
        JdbcLineItemRepository capped = new JdbcLineItemRepository(dataSource, 5, 2);

        List<ClassificationPeriodRow> rows = capped.getClassificationPeriodData(filter().build()).value();

        assertThat(rows).extracting(row -> row.year() + "/" + row.functionalCode())
                .containsExactly("2023/65.02", "2023/84.02");
    }

    @Test
    void normalizesEachYearBeforeGroupingAndOrdering() {
        NormalizedAggregateRepository.NormalizedAggregatedResult result = repository.getNormalizedAggregatedItems(
                filter().build(),
                eurMultipliers(),
                new NormalizedAggregateRepository.Pagination(10, 0),
                AggregateFilters.NONE
        ).value();

        assertThat(result.totalCount()).isEqualTo(4);
        assertThat(result.items()).extracting(AggregatedClassification::amount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("250"), new BigDecimal("200"), new BigDecimal("75"), new BigDecimal("50"));
        assertThat(result.items().get(0).count()).isEqualTo(2);
    }

    @Test
    void thresholdsAndPagingRunOnNormalizedTotals() {
        NormalizedAggregateRepository.NormalizedAggregatedResult filtered = repository.getNormalizedAggregatedItems(
                filter().build(),
                eurMultipliers(),
                new NormalizedAggregateRepository.Pagination(10, 0),
                new AggregateFilters(new BigDecimal("60"), null)
        ).value();
        NormalizedAggregateRepository.NormalizedAggregatedResult page = repository.getNormalizedAggregatedItems(
                filter().build(),
                eurMultipliers(),
                new NormalizedAggregateRepository.Pagination(2, 1),
                AggregateFilters.NONE
        ).value();

        assertThat(filtered.totalCount()).isEqualTo(3);
        assertThat(page.totalCount()).isEqualTo(4);
        assertThat(page.items()).extracting(AggregatedClassification::functionalCode).containsExactly("84.02", "51.02");
    }

    @Test
    void yearsWithoutMultiplierAreLeftOut() {
        NormalizedAggregateRepository.NormalizedAggregatedResult result = repository.getNormalizedAggregatedItems(
                filter().build(),
                Map.of("2023", new BigDecimal("0.2")),
                new NormalizedAggregateRepository.Pagination(10, 0),
                AggregateFilters.NONE
        ).value();

        assertThat(result.totalCount()).isEqualTo(2);
        assertThat(repository.getNormalizedAggregatedItems(
                filter().build(), Map.of(), new NormalizedAggregateRepository.Pagination(10, 0), AggregateFilters.NONE
        ).value().items()).isEmpty();
    }

    @Test
    void missingSchemaIsReportedAsDatabaseError() {
        JdbcLineItemRepository empty = new JdbcLineItemRepository(dataSource(), 5);

        AggregationResult<List<ClassificationPeriodRow>> result = empty.getClassificationPeriodData(filter().build());

        assertThat(result.isOk()).isFalse();
        assertThat(result.error().kind()).isEqualTo(AggregationError.Kind.DATABASE_ERROR);
        assertThat(result.error().retryable()).isTrue();
    }

    private static Map<String, BigDecimal> eurMultipliers() {
        Map<String, BigDecimal> multipliers = new LinkedHashMap<>();
        multipliers.put("2023", new BigDecimal("0.2"));
        multipliers.put("2024", new BigDecimal("0.25"));
        return multipliers;
    }

    private List<ClassificationPeriodRow> rows(AnalyticsFilter.Builder filter) {
        return rows(filter.build());
    }

    private List<ClassificationPeriodRow> rows(AnalyticsFilter filter) {
        return repository.getClassificationPeriodData(filter).value();
    }

    private static ExclusionsBuilder exclusions() {
        return new ExclusionsBuilder();
    }

    private static AnalyticsFilter.Builder filter() {
        return AnalyticsFilter.builder()
                .accountCategory("ch")
                .reportPeriod(ReportPeriod.yearInterval(2023, 2024));
    }

    private static JdbcDataSource dataSource() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");
        return dataSource;
    }

    private static final class ExclusionsBuilder {
        private List<String> entityCuis;
        private List<String> functionalCodes;
        private List<String> functionalPrefixes;
        private List<String> economicCodes;
        private List<String> economicPrefixes;
        private List<String> entityTypes;
        private List<String> countyCodes;

        ExclusionsBuilder entityCuis(List<String> values) {
            this.entityCuis = values;
            return this;
        }

        ExclusionsBuilder functionalCodes(List<String> values) {
            this.functionalCodes = values;
            return this;
        }

        ExclusionsBuilder functionalPrefixes(List<String> values) {
            this.functionalPrefixes = values;
            return this;
        }

        ExclusionsBuilder economicCodes(List<String> values) {
            this.economicCodes = values;
            return this;
        }

        ExclusionsBuilder economicPrefixes(List<String> values) {
            this.economicPrefixes = values;
            return this;
        }

        ExclusionsBuilder entityTypes(List<String> values) {
            this.entityTypes = values;
            return this;
        }

        ExclusionsBuilder countyCodes(List<String> values) {
            this.countyCodes = values;
            return this;
        }

        AnalyticsFilter.Exclusions build() {
            return new AnalyticsFilter.Exclusions(
                    entityCuis, functionalCodes, functionalPrefixes, economicCodes, economicPrefixes, entityTypes, countyCodes);
        }
    }
}
