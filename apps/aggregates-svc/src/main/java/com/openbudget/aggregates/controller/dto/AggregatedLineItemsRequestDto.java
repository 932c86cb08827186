package com.openbudget.aggregates.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.openbudget.aggregates.model.AnalyticsFilter;
import com.openbudget.aggregates.model.ReportPeriod;
import com.openbudget.aggregates.normalization.Frequency;
import com.openbudget.aggregates.normalization.NormalizationConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

public record AggregatedLineItemsRequestDto(
        @NotNull @Valid FilterInput filter,
        Integer limit,
        Integer offset
) {

    public record FilterInput(
            @NotBlank String accountCategory,
            @NotNull @Valid ReportPeriodInput reportPeriod,
            String reportType,
            List<String> entityCuis,
            List<Long> uatIds,
            List<String> countyCodes,
            List<String> entityTypes,
            @JsonProperty("isUat") Boolean isUat,
            List<String> functionalCodes,
            List<String> functionalPrefixes,
            List<String> economicCodes,
            List<String> economicPrefixes,
            ExcludeInput exclude,
            BigDecimal itemMinAmount,
            BigDecimal itemMaxAmount,
            BigDecimal aggregateMinAmount,
            BigDecimal aggregateMaxAmount,
            String normalization,
            String currency,
            Boolean inflationAdjusted
    ) {
    }

    public record ReportPeriodInput(@NotBlank String type, IntervalInput interval, List<String> dates) {
    }

    public record IntervalInput(String start, String end) {
    }

    public record ExcludeInput(
            List<String> entityCuis,
            List<String> functionalCodes,
            List<String> functionalPrefixes,
            List<String> economicCodes,
            List<String> economicPrefixes,
            List<String> entityTypes,
            List<String> countyCodes
    ) {
        AnalyticsFilter.Exclusions toExclusions() {
            return new AnalyticsFilter.Exclusions(
                    entityCuis, functionalCodes, functionalPrefixes, economicCodes, economicPrefixes, entityTypes, countyCodes);
        }
    }

    /**
     * @throws IllegalArgumentException for an unknown period type, normalization or currency
     */
    public AnalyticsFilter toFilter() {
        ReportPeriodInput period = filter.reportPeriod();
        ReportPeriod reportPeriod = new ReportPeriod(
                parseFrequency(period.type()),
                period.interval() == null ? null : new ReportPeriod.Interval(period.interval().start(), period.interval().end()),
                period.dates()
        );
        return AnalyticsFilter.builder()
                .accountCategory(filter.accountCategory())
                .reportPeriod(reportPeriod)
                .reportType(filter.reportType())
                .entityCuis(filter.entityCuis())
                .uatIds(filter.uatIds())
                .countyCodes(filter.countyCodes())
                .entityTypes(filter.entityTypes())
                .isUat(filter.isUat())
                .functionalCodes(filter.functionalCodes())
                .functionalPrefixes(filter.functionalPrefixes())
                .economicCodes(filter.economicCodes())
                .economicPrefixes(filter.economicPrefixes())
                .exclude(filter.exclude() == null ? null : filter.exclude().toExclusions())
                .itemMinAmount(filter.itemMinAmount())
                .itemMaxAmount(filter.itemMaxAmount())
                .aggregateMinAmount(filter.aggregateMinAmount())
                .aggregateMaxAmount(filter.aggregateMaxAmount())
                .normalization(NormalizationConfig.resolve(filter.normalization(), filter.currency(), filter.inflationAdjusted()))
                .build();
    }

    private static Frequency parseFrequency(String type) {
        try {
            return Frequency.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported report period type: " + type);
        }
    }
}
