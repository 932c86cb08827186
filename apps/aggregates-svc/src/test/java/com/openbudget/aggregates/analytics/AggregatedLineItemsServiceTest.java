package com.openbudget.aggregates.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.openbudget.aggregates.config.AggregatesProperties;
import com.openbudget.aggregates.model.AggregatedLineItem;
import com.openbudget.aggregates.model.AggregatedLineItemConnection;
import com.openbudget.aggregates.model.AnalyticsFilter;
import com.openbudget.aggregates.model.ReportPeriod;
import com.openbudget.aggregates.normalization.FactorBundle;
import com.openbudget.aggregates.normalization.FactorProvider;
import com.openbudget.aggregates.normalization.Frequency;
import com.openbudget.aggregates.normalization.MultiplierCompositor;
import com.openbudget.aggregates.normalization.NormalizationConfig;
import com.openbudget.aggregates.normalization.NormalizationDatasetException;
import com.openbudget.aggregates.population.InMemoryPopulationRepository;
import com.openbudget.aggregates.population.PopulationDenominatorResolver;
import com.openbudget.aggregates.repository.BudgetSeed;
import com.openbudget.aggregates.repository.ClassificationPeriodRepository;
import com.openbudget.aggregates.repository.InMemoryBudgetStore;
import com.openbudget.aggregates.repository.InMemoryLineItemRepository;
import com.openbudget.aggregates.repository.NormalizedAggregateRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class AggregatedLineItemsServiceTest {

    private static final NormalizationConfig EUR = new NormalizationConfig(NormalizationConfig.Mode.TOTAL, NormalizationConfig.Currency.EUR, false);

    @Mock
    private FactorProvider factorProvider;

    private final MultiplierCompositor compositor = new MultiplierCompositor();

    private final FactorBundle factors = new FactorBundle(
            Map.of("2023", new BigDecimal("1.2"), "2024", new BigDecimal("1.0")),
            Map.of("2023", new BigDecimal("5"), "2024", new BigDecimal("4")),
            Map.of("2023", new BigDecimal("4.5"), "2024", new BigDecimal("4.6")),
            Map.of("2023", new BigDecimal("1000"), "2024", new BigDecimal("2000")),
            Map.of("2023", new BigDecimal("19000"), "2024", new BigDecimal("18900"))
    );

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(factorProvider.generateFactors(Frequency.YEAR, 2023, 2024)).thenReturn(factors);
    }

    @ParameterizedTest
    @EnumSource(ExecutionStrategy.class)
    void convertsEachYearAtItsOwnRateBeforeSumming(ExecutionStrategy strategy) {
        InMemoryBudgetStore store = store(
                item("100", 2023, "65.02", "10.01.01", "500"),
                item("100", 2024, "65.02", "10.01.01", "600"));

        AggregatedLineItemConnection connection = service(store, strategy).getAggregatedLineItems(filter(EUR).build(), null, null).value();

        assertThat(connection.nodes()).hasSize(1);
        assertThat(connection.nodes().get(0).amount()).isCloseTo(250.0, within(1e-9));
        assertThat(connection.nodes().get(0).count()).isEqualTo(2);
    }

    @ParameterizedTest
    @EnumSource(ExecutionStrategy.class)
    void percentGdpIgnoresCurrencyAndInflation(ExecutionStrategy strategy) {
        InMemoryBudgetStore store = store(
                item("100", 2023, "65.02", "10.01.01", "500"),
                item("100", 2024, "65.02", "10.01.01", "600"));
        NormalizationConfig config = new NormalizationConfig(NormalizationConfig.Mode.PERCENT_GDP, NormalizationConfig.Currency.EUR, true);

        AggregatedLineItemConnection connection = service(store, strategy).getAggregatedLineItems(filter(config).build(), null, null).value();

        assertThat(connection.nodes().get(0).amount()).isCloseTo(80.0, within(1e-9));
    }

    @ParameterizedTest
    @EnumSource(ExecutionStrategy.class)
    void thresholdsApplyToNormalizedTotals(ExecutionStrategy strategy) {
        InMemoryBudgetStore store = store(
                item("100", 2023, "65.02", "10.01.01", "500"),
                item("100", 2024, "84.02", "71.01.01", "200"),
                item("100", 2023, "51.02", "20.01.01", "100"));
        AnalyticsFilter filter = filter(EUR).aggregateMinAmount(new BigDecimal("50")).build();

        AggregatedLineItemConnection connection = service(store, strategy).getAggregatedLineItems(filter, null, null).value();

        assertThat(connection.nodes()).extracting(AggregatedLineItem::functionalCode).containsExactly("65.02", "84.02");
        assertThat(connection.pageInfo().totalCount()).isEqualTo(2);
    }

    @ParameterizedTest
    @EnumSource(ExecutionStrategy.class)
    void perCapitaDividesByTheResolvedPopulation(ExecutionStrategy strategy) {
        InMemoryBudgetStore store = store(
                item("100", 2023, "65.02", "10.01.01", "500"),
                item("100", 2024, "65.02", "10.01.01", "600"));
        NormalizationConfig config = new NormalizationConfig(NormalizationConfig.Mode.PER_CAPITA, NormalizationConfig.Currency.RON, false);

        AggregatedLineItemConnection connection = service(store, strategy).getAggregatedLineItems(filter(config).build(), null, null).value();

        assertThat(connection.nodes().get(0).amount()).isCloseTo(11.0, within(1e-9));
    }

    @ParameterizedTest
    @EnumSource(ExecutionStrategy.class)
    void pagesThroughSortedGroups(ExecutionStrategy strategy) {
        AggregatedLineItemsService service = service(threeGroups(), strategy);

        AggregatedLineItemConnection first = service.getAggregatedLineItems(filter(NormalizationConfig.NONE).build(), 2, 0).value();
        AggregatedLineItemConnection second = service.getAggregatedLineItems(filter(NormalizationConfig.NONE).build(), 2, 2).value();

        assertThat(first.nodes()).extracting(AggregatedLineItem::functionalCode).containsExactly("84.02", "65.02");
        assertThat(first.pageInfo()).isEqualTo(new AggregatedLineItemConnection.PageInfo(3, true, false));
        assertThat(second.nodes()).extracting(AggregatedLineItem::functionalCode).containsExactly("51.02");
        assertThat(second.pageInfo()).isEqualTo(new AggregatedLineItemConnection.PageInfo(3, false, true));
    }

    @ParameterizedTest
    @EnumSource(ExecutionStrategy.class)
    void clampsLimitAndOffset(ExecutionStrategy strategy) {
        AggregatedLineItemsService service = service(threeGroups(), strategy);
        AnalyticsFilter filter = filter(NormalizationConfig.NONE).build();

        AggregatedLineItemConnection zero = service.getAggregatedLineItems(filter, -5, -3).value();
        AggregatedLineItemConnection huge = service.getAggregatedLineItems(filter, 5000, null).value();

        assertThat(zero.nodes()).isEmpty();
        assertThat(zero.pageInfo()).isEqualTo(new AggregatedLineItemConnection.PageInfo(3, true, false));
        assertThat(huge.nodes()).hasSize(3);
        assertThat(huge.pageInfo().hasNextPage()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(ExecutionStrategy.class)
    void tiesAreOrderedByCodesAndRepeatedRunsMatch(ExecutionStrategy strategy) {
        InMemoryBudgetStore store = store(
                item("100", 2024, "84.02", "71.01.01", "100"),
                item("100", 2024, "65.02", "20.01.01", "100"),
                item("100", 2024, "65.02", "10.01.01", "100"));
        AggregatedLineItemsService service = service(store, strategy);
        AnalyticsFilter filter = filter(NormalizationConfig.NONE).build();

        AggregatedLineItemConnection first = service.getAggregatedLineItems(filter, null, null).value();
        AggregatedLineItemConnection second = service.getAggregatedLineItems(filter, null, null).value();

        assertThat(first.nodes())
                .extracting(node -> node.functionalCode() + "/" + node.economicCode())
                .containsExactly("65.02/10.01.01", "65.02/20.01.01", "84.02/71.01.01");
        assertThat(second).isEqualTo(first);
    }

    @ParameterizedTest
    @EnumSource(ExecutionStrategy.class)
    void discreteDatesSelectTheSameYearsInBothStrategies(ExecutionStrategy strategy) {
        when(factorProvider.generateFactors(Frequency.YEAR, 2022, 2024)).thenReturn(new FactorBundle(
                Map.of("2022", BigDecimal.ONE, "2023", BigDecimal.ONE, "2024", BigDecimal.ONE),
                Map.of("2022", new BigDecimal("5"), "2023", new BigDecimal("5"), "2024", new BigDecimal("4")),
                Map.of(),
                Map.of(),
                Map.of()));
        InMemoryBudgetStore store = store(
                item("100", 2022, "65.02", "10.01.01", "500"),
                item("100", 2023, "65.02", "10.01.01", "1000"),
                item("100", 2024, "65.02", "10.01.01", "600"));
        AnalyticsFilter filter = filter(EUR)
                .reportPeriod(new ReportPeriod(Frequency.YEAR, null, List.of("2022", "2024")))
                .build();

        AggregatedLineItemConnection connection = service(store, strategy).getAggregatedLineItems(filter, null, null).value();

        assertThat(connection.pageInfo().totalCount()).isEqualTo(1);
        assertThat(connection.nodes().get(0).amount()).isCloseTo(250.0, within(1e-9));
        assertThat(connection.nodes().get(0).count()).isEqualTo(2);
    }

    @Test
    void strategiesAgreeOnEveryNormalization() {
        InMemoryBudgetStore store = store(
                item("100", 2023, "65.02", "10.01.01", "500"),
                item("100", 2024, "65.02", "10.01.01", "600"),
                item("100", 2023, "84.02", "71.01.01", "900"),
                item("100", 2024, "51.02", null, "-40"));
        List<NormalizationConfig> configs = List.of(
                NormalizationConfig.NONE,
                new NormalizationConfig(NormalizationConfig.Mode.TOTAL, NormalizationConfig.Currency.USD, true),
                new NormalizationConfig(NormalizationConfig.Mode.PER_CAPITA, NormalizationConfig.Currency.EUR, true),
                new NormalizationConfig(NormalizationConfig.Mode.PERCENT_GDP, null, false));

        for (NormalizationConfig config : configs) {
            AnalyticsFilter filter = filter(config).build();
            AggregatedLineItemConnection inMemory = service(store, ExecutionStrategy.IN_MEMORY).getAggregatedLineItems(filter, 2, 1).value();
            AggregatedLineItemConnection inStore = service(store, ExecutionStrategy.STORE_DELEGATED).getAggregatedLineItems(filter, 2, 1).value();

            assertThat(inStore.pageInfo()).as(config.toString()).isEqualTo(inMemory.pageInfo());
            assertThat(inStore.nodes()).hasSameSizeAs(inMemory.nodes());
            for (int i = 0; i < inMemory.nodes().size(); i++) {
                AggregatedLineItem expected = inMemory.nodes().get(i);
                AggregatedLineItem actual = inStore.nodes().get(i);
                assertThat(actual.functionalCode()).isEqualTo(expected.functionalCode());
                assertThat(actual.economicCode()).isEqualTo(expected.economicCode());
                assertThat(actual.count()).isEqualTo(expected.count());
                assertThat(actual.amount()).isCloseTo(expected.amount(), within(1e-9));
            }
        }
    }

    @ParameterizedTest
    @EnumSource(ExecutionStrategy.class)
    void factorsAreNotLoadedWhenNothingNeedsNormalizing(ExecutionStrategy strategy) {
        AggregatedLineItemConnection connection = service(threeGroups(), strategy)
                .getAggregatedLineItems(filter(NormalizationConfig.NONE).build(), null, null)
                .value();

        assertThat(connection.nodes()).hasSize(3);
        verify(factorProvider, never()).generateFactors(any(), anyInt(), anyInt());
    }

    @ParameterizedTest
    @EnumSource(ExecutionStrategy.class)
    void missingFactorDataIsANonRetryableError(ExecutionStrategy strategy) {
        when(factorProvider.generateFactors(Frequency.YEAR, 2023, 2024))
                .thenThrow(new NormalizationDatasetException(List.of("ro.economics.cpi.yearly"), Map.of()));

        AggregationResult<AggregatedLineItemConnection> result = service(threeGroups(), strategy)
                .getAggregatedLineItems(filter(EUR).build(), null, null);

        assertThat(result.isOk()).isFalse();
        assertThat(result.error().kind()).isEqualTo(AggregationError.Kind.NORMALIZATION_DATA_ERROR);
        assertThat(result.error().retryable()).isFalse();
    }

    @Test
    void repositoryFailuresPropagateUnchanged() {
        ClassificationPeriodRepository failing = mock(ClassificationPeriodRepository.class);
        AggregationError timeout = AggregationError.timeout("Failed to fetch aggregated line items: query timed out", null);
        when(failing.getClassificationPeriodData(any())).thenReturn(AggregationResult.failure(timeout));
        AggregatedLineItemsService service = new AggregatedLineItemsService(
                failing,
                mock(NormalizedAggregateRepository.class),
                factorProvider,
                compositor,
                new PopulationDenominatorResolver(new InMemoryPopulationRepository(threeGroups())),
                properties(ExecutionStrategy.IN_MEMORY));

        AggregationResult<AggregatedLineItemConnection> result = service.getAggregatedLineItems(filter(EUR).build(), null, null);

        assertThat(result.error()).isEqualTo(timeout);
    }

    @ParameterizedTest
    @EnumSource(ExecutionStrategy.class)
    void noMatchingRowsYieldsAnEmptyPage(ExecutionStrategy strategy) {
        AnalyticsFilter filter = filter(EUR).accountCategory("vn").build();

        AggregatedLineItemConnection connection = service(threeGroups(), strategy).getAggregatedLineItems(filter, 10, 20).value();

        assertThat(connection.nodes()).isEmpty();
        assertThat(connection.pageInfo()).isEqualTo(new AggregatedLineItemConnection.PageInfo(0, false, true));
    }

    private AggregatedLineItemsService service(InMemoryBudgetStore store, ExecutionStrategy strategy) {
        InMemoryLineItemRepository repository = new InMemoryLineItemRepository(store);
        return new AggregatedLineItemsService(
                repository,
                repository,
                factorProvider,
                compositor,
                new PopulationDenominatorResolver(new InMemoryPopulationRepository(store)),
                properties(strategy));
    }

    private static AggregatesProperties properties(ExecutionStrategy strategy) {
        return new AggregatesProperties(strategy, AggregatesProperties.RepositoryType.MEMORY, null, null, null, null);
    }

    private static AnalyticsFilter.Builder filter(NormalizationConfig normalization) {
        return AnalyticsFilter.builder()
                .accountCategory("ch")
                .reportPeriod(ReportPeriod.yearInterval(2023, 2024))
                .normalization(normalization);
    }

    private static InMemoryBudgetStore threeGroups() {
        return store(
                item("100", 2024, "84.02", "71.01.01", "900"),
                item("100", 2023, "65.02", "10.01.01", "500"),
                item("100", 2024, "51.02", "20.01.01", "100"));
    }

    private static InMemoryBudgetStore store(BudgetSeed.LineItem... items) {
        return new InMemoryBudgetStore(new BudgetSeed(
                List.of(new BudgetSeed.Uat(1, "CJ", "CJ", "Judetul Cluj", new BigDecimal("100"))),
                List.of(new BudgetSeed.Entity("100", "Municipiul Cluj-Napoca", "admin_municipality", 1L, true)),
                Map.of("51.02", "Autoritati publice", "65.02", "Invatamant", "84.02", "Transporturi"),
                Map.of("10.01.01", "Salarii de baza", "20.01.01", "Furnituri de birou", "71.01.01", "Constructii"),
                List.of(items)));
    }

    private static BudgetSeed.LineItem item(String cui, int year, String functionalCode, String economicCode, String amount) {
        BigDecimal ytd = new BigDecimal(amount);
        return new BudgetSeed.LineItem(cui, "ch", "PRINCIPAL_AGGREGATED", year, functionalCode, economicCode, ytd, ytd, ytd, true, true);
    }
}
