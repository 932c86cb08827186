package com.openbudget.aggregates.repository;

import com.openbudget.aggregates.model.AnalyticsFilter;
import com.openbudget.aggregates.model.ClassificationPeriodRow;
import com.openbudget.aggregates.model.ReportPeriod;
import com.openbudget.aggregates.normalization.Frequency;
import com.openbudget.aggregates.normalization.PeriodLabels;
import java.util.List;
import java.util.OptionalInt;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * Builds the filtered line item projection shared by both JDBC queries. The projection exposes
 * {@code functional_code, functional_name, economic_code, economic_name, report_year, amount}
 * with unknown economic classifications already defaulted.
 */
final class LineItemSql {

    private final StringBuilder sql = new StringBuilder();
    private final MapSqlParameterSource params;

    private LineItemSql(MapSqlParameterSource params) {
        this.params = params;
    }

    static LineItemSql projection(AnalyticsFilter filter, MapSqlParameterSource params, String extraJoin, String amountFactor) {
        LineItemSql builder = new LineItemSql(params);
        builder.build(filter, extraJoin, amountFactor);
        return builder;
    }

    String sql() {
        return sql.toString();
    }

    private void build(AnalyticsFilter filter, String extraJoin, String amountFactor) {
        Frequency frequency = filter.reportPeriod().type();
        params.addValue("unknownEconomicCode", ClassificationPeriodRow.UNKNOWN_ECONOMIC_CODE);
        params.addValue("unknownEconomicName", ClassificationPeriodRow.UNKNOWN_ECONOMIC_NAME);
        sql.append("""
                SELECT fc.functional_code AS functional_code,
                       fc.functional_name AS functional_name,
                       COALESCE(eli.economic_code, :unknownEconomicCode) AS economic_code,
                       COALESCE(ec.economic_name, :unknownEconomicName) AS economic_name,
                       eli.report_year AS report_year,
                """);
        sql.append("       ").append(amountColumn(frequency));
        if (amountFactor != null) {
            sql.append(" * ").append(amountFactor);
        }
        sql.append(" AS amount\n");
        sql.append("""
                FROM execution_line_items eli
                JOIN functional_classifications fc ON eli.functional_code = fc.functional_code
                LEFT JOIN economic_classifications ec ON eli.economic_code = ec.economic_code
                """);
        AnalyticsFilter.Exclusions exclude = filter.exclude();
        boolean countyJoin = !filter.countyCodes().isEmpty() || !exclude.countyCodes().isEmpty();
        boolean entityJoin = countyJoin || !filter.entityTypes().isEmpty() || filter.isUat() != null
                || !filter.uatIds().isEmpty() || !exclude.entityTypes().isEmpty();
        if (entityJoin) {
            sql.append("LEFT JOIN entities e ON eli.entity_cui = e.cui\n");
        }
        if (countyJoin) {
            sql.append("LEFT JOIN uats u ON e.uat_id = u.id\n");
        }
        if (extraJoin != null) {
            sql.append(extraJoin).append('\n');
        }
        sql.append("WHERE eli.account_category = :accountCategory\n");
        params.addValue("accountCategory", filter.accountCategory());
        switch (frequency) {
            case QUARTER -> sql.append("  AND eli.is_quarterly = TRUE\n");
            case YEAR -> sql.append("  AND eli.is_yearly = TRUE\n");
            case MONTH -> {
            }
        }
        appendPeriod(filter.reportPeriod());
        if (filter.reportType() != null) {
            sql.append("  AND eli.report_type = :reportType\n");
            params.addValue("reportType", filter.reportType());
        }
        appendIn("eli.entity_cui", "entityCuis", filter.entityCuis());
        appendIn("eli.functional_code", "functionalCodes", filter.functionalCodes());
        appendPrefixes("eli.functional_code", "functionalPrefix", filter.functionalPrefixes());
        appendIn("eli.economic_code", "economicCodes", filter.economicCodes());
        appendPrefixes("eli.economic_code", "economicPrefix", filter.economicPrefixes());
        appendIn("e.entity_type", "entityTypes", filter.entityTypes());
        if (filter.isUat() != null) {
            sql.append("  AND e.is_uat = :isUat\n");
            params.addValue("isUat", filter.isUat());
        }
        appendIn("e.uat_id", "uatIds", filter.uatIds());
        appendIn("u.county_code", "countyCodes", filter.countyCodes());
        appendExclusions(filter);
        appendItemAmountBounds(filter, frequency);
    }

    private void appendExclusions(AnalyticsFilter filter) {
        AnalyticsFilter.Exclusions exclude = filter.exclude();
        appendNotIn("eli.entity_cui", "excludedEntityCuis", exclude.entityCuis());
        appendNotIn("eli.functional_code", "excludedFunctionalCodes", exclude.functionalCodes());
        appendNotPrefixes("eli.functional_code", "excludedFunctionalPrefix", exclude.functionalPrefixes());
        if (filter.appliesEconomicExclusions()) {
            appendNotIn("eli.economic_code", "excludedEconomicCodes", exclude.economicCodes());
            appendNotPrefixes("eli.economic_code", "excludedEconomicPrefix", exclude.economicPrefixes());
        }
        appendNotIn("e.entity_type", "excludedEntityTypes", exclude.entityTypes());
        appendNotIn("u.county_code", "excludedCountyCodes", exclude.countyCodes());
    }

    private void appendItemAmountBounds(AnalyticsFilter filter, Frequency frequency) {
        if (filter.itemMinAmount() != null) {
            sql.append("  AND ").append(amountColumn(frequency)).append(" >= :itemMinAmount\n");
            params.addValue("itemMinAmount", filter.itemMinAmount());
        }
        if (filter.itemMaxAmount() != null) {
            sql.append("  AND ").append(amountColumn(frequency)).append(" <= :itemMaxAmount\n");
            params.addValue("itemMaxAmount", filter.itemMaxAmount());
        }
    }

    private void appendPeriod(ReportPeriod period) {
        if (period.interval() != null) {
            OptionalInt start = PeriodLabels.extractYear(period.interval().start());
            OptionalInt end = PeriodLabels.extractYear(period.interval().end());
            if (start.isPresent()) {
                sql.append("  AND eli.report_year >= :startYear\n");
                params.addValue("startYear", start.getAsInt());
            }
            if (end.isPresent()) {
                sql.append("  AND eli.report_year <= :endYear\n");
                params.addValue("endYear", end.getAsInt());
            }
            return;
        }
        List<Integer> years = period.selectedYears();
        if (!years.isEmpty()) {
            sql.append("  AND eli.report_year IN (:years)\n");
            params.addValue("years", years);
        }
    }

    private void appendIn(String column, String param, List<?> values) {
        if (values.isEmpty()) {
            return;
        }
        sql.append("  AND ").append(column).append(" IN (:").append(param).append(")\n");
        params.addValue(param, values);
    }

    private void appendPrefixes(String column, String param, List<String> prefixes) {
        if (prefixes.isEmpty()) {
            return;
        }
        sql.append("  AND (");
        for (int i = 0; i < prefixes.size(); i++) {
            if (i > 0) {
                sql.append(" OR ");
            }
            String name = param + i;
            sql.append(column).append(" LIKE :").append(name);
            params.addValue(name, prefixes.get(i) + "%");
        }
        sql.append(")\n");
    }

    // NULL columns never match NOT IN / NOT LIKE, so they are kept explicitly.
    private void appendNotIn(String column, String param, List<?> values) {
        if (values.isEmpty()) {
            return;
        }
        sql.append("  AND (").append(column).append(" IS NULL OR ").append(column)
                .append(" NOT IN (:").append(param).append("))\n");
        params.addValue(param, values);
    }

    private void appendNotPrefixes(String column, String param, List<String> prefixes) {
        if (prefixes.isEmpty()) {
            return;
        }
        sql.append("  AND (").append(column).append(" IS NULL OR NOT (");
        for (int i = 0; i < prefixes.size(); i++) {
            if (i > 0) {
                sql.append(" OR ");
            }
            String name = param + i;
            sql.append(column).append(" LIKE :").append(name);
            params.addValue(name, prefixes.get(i) + "%");
        }
        sql.append("))\n");
    }

    private static String amountColumn(Frequency frequency) {
        return switch (frequency) {
            case MONTH -> "COALESCE(eli.monthly_amount, 0)";
            case QUARTER -> "COALESCE(eli.quarterly_amount, 0)";
            case YEAR -> "COALESCE(eli.ytd_amount, 0)";
        };
    }
}
