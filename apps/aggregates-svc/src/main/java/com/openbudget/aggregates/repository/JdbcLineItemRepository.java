package com.openbudget.aggregates.repository;

import com.openbudget.aggregates.analytics.AggregationError;
import com.openbudget.aggregates.analytics.AggregationResult;
import com.openbudget.aggregates.model.AggregatedClassification;
import com.openbudget.aggregates.model.AnalyticsFilter;
import com.openbudget.aggregates.model.ClassificationKey;
import com.openbudget.aggregates.model.ClassificationPeriodRow;
import com.openbudget.aggregates.normalization.PeriodLabels;
import java.math.BigDecimal;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;

/**
 * SQL implementation of both line item ports over the {@code execution_line_items} schema.
 *
 * <p>The store-delegated query passes the multiplier table as an inline derived table joined on
 * the report year, so grouping, HAVING, ordering and LIMIT/OFFSET run on normalized amounts.
 * Code tie-breaks compare bytewise on PostgreSQL ({@code COLLATE "C"}) to match Java string order.
 */
public class JdbcLineItemRepository implements ClassificationPeriodRepository, NormalizedAggregateRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcLineItemRepository.class);

    // Multipliers can be very small (per capita, percent of GDP), keep plenty of scale.
    private static final String MULTIPLIER_TYPE = "NUMERIC(65, 30)";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final int maxRows;
    private final String codeCollation;

    public JdbcLineItemRepository(DataSource dataSource, int queryTimeoutSeconds) {
        this(dataSource, queryTimeoutSeconds, MAX_ROWS);
    }

    JdbcLineItemRepository(DataSource dataSource, int queryTimeoutSeconds, int maxRows) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        template.setQueryTimeout(queryTimeoutSeconds);
        this.jdbcTemplate = new NamedParameterJdbcTemplate(template);
        this.maxRows = maxRows;
        this.codeCollation = codeCollation(dataSource);
    }

    @Override
    public AggregationResult<List<ClassificationPeriodRow>> getClassificationPeriodData(AnalyticsFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String projection = LineItemSql.projection(filter, params, null, null).sql();
        String sql = """
                SELECT li.functional_code,
                       li.functional_name,
                       li.economic_code,
                       li.economic_name,
                       li.report_year,
                       COALESCE(SUM(li.amount), 0) AS amount,
                       COUNT(*) AS item_count
                FROM (
                %1$s) li
                GROUP BY li.functional_code, li.functional_name, li.economic_code, li.economic_name, li.report_year
                ORDER BY li.report_year ASC, li.functional_code%2$s ASC, li.economic_code%2$s ASC
                LIMIT :maxRows
                """.formatted(projection, codeCollation);
        params.addValue("maxRows", maxRows);
        try {
            List<ClassificationPeriodRow> rows = jdbcTemplate.query(sql, params, this::mapPeriodRow);
            if (rows.size() >= maxRows) {
                log.warn("classification_period_rows_truncated maxRows={} accountCategory={} frequency={}",
                        maxRows, filter.accountCategory(), filter.reportPeriod().type());
            }
            return AggregationResult.ok(rows);
        } catch (DataAccessException ex) {
            log.warn("classification_period_query_failed reason={}", ex.getMessage());
            return AggregationResult.failure(AggregationError.fromDataAccess("Failed to fetch aggregated line items", ex));
        }
    }

    @Override
    public AggregationResult<NormalizedAggregatedResult> getNormalizedAggregatedItems(
            AnalyticsFilter filter,
            Map<String, BigDecimal> factorMap,
            Pagination pagination,
            AggregateFilters aggregateFilters
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String factors = factorsTable(factorMap, params);
        if (factors == null) {
            return AggregationResult.ok(new NormalizedAggregatedResult(List.of(), 0));
        }
        String projection = LineItemSql.projection(
                filter,
                params,
                "JOIN (" + factors + ") f ON eli.report_year = f.period_year",
                "f.multiplier"
        ).sql();

        StringBuilder grouped = new StringBuilder("""
                SELECT li.functional_code,
                       li.functional_name,
                       li.economic_code,
                       li.economic_name,
                       COALESCE(SUM(li.amount), 0) AS amount,
                       COUNT(*) AS item_count
                FROM (
                """);
        grouped.append(projection).append(") li\n");
        grouped.append("GROUP BY li.functional_code, li.functional_name, li.economic_code, li.economic_name\n");
        AggregateFilters having = aggregateFilters == null ? AggregateFilters.NONE : aggregateFilters;
        if (!having.isEmpty()) {
            grouped.append("HAVING 1 = 1\n");
            if (having.minAmount() != null) {
                grouped.append("  AND COALESCE(SUM(li.amount), 0) >= :minAmount\n");
                params.addValue("minAmount", having.minAmount());
            }
            if (having.maxAmount() != null) {
                grouped.append("  AND COALESCE(SUM(li.amount), 0) <= :maxAmount\n");
                params.addValue("maxAmount", having.maxAmount());
            }
        }

        String pageSql = """
                SELECT g.functional_code, g.functional_name, g.economic_code, g.economic_name, g.amount, g.item_count
                FROM (
                %1$s) g
                ORDER BY g.amount DESC, g.functional_code%2$s ASC, g.economic_code%2$s ASC
                LIMIT :limit OFFSET :offset
                """.formatted(grouped, codeCollation);
        String countSql = """
                SELECT COUNT(*) FROM (
                %s) g
                """.formatted(grouped);
        params.addValue("limit", pagination.limit());
        params.addValue("offset", pagination.offset());
        try {
            List<AggregatedClassification> items = jdbcTemplate.query(pageSql, params, this::mapAggregated);
            Long total = jdbcTemplate.queryForObject(countSql, params, Long.class);
            return AggregationResult.ok(new NormalizedAggregatedResult(items, total == null ? 0 : total));
        } catch (DataAccessException ex) {
            log.warn("normalized_aggregate_query_failed reason={}", ex.getMessage());
            return AggregationResult.failure(AggregationError.fromDataAccess("Failed to fetch normalized aggregated line items", ex));
        }
    }

    /**
     * Inline {@code (period_year, multiplier)} rows built from yearly labels; non-yearly labels are
     * skipped because rows are grouped by year. Returns {@code null} when nothing is left.
     */
    private String factorsTable(Map<String, BigDecimal> factorMap, MapSqlParameterSource params) {
        StringBuilder sql = new StringBuilder();
        int index = 0;
        for (Map.Entry<String, BigDecimal> entry : factorMap.entrySet()) {
            OptionalInt year = PeriodLabels.yearIndex(entry.getKey());
            if (year.isEmpty() || entry.getValue() == null) {
                continue;
            }
            if (index > 0) {
                sql.append(" UNION ALL ");
            }
            sql.append("SELECT CAST(:factorYear").append(index).append(" AS INTEGER) AS period_year, CAST(:factorMultiplier")
                    .append(index).append(" AS ").append(MULTIPLIER_TYPE).append(") AS multiplier");
            params.addValue("factorYear" + index, year.getAsInt());
            params.addValue("factorMultiplier" + index, entry.getValue());
            index++;
        }
        return index == 0 ? null : sql.toString();
    }

    private static String codeCollation(DataSource dataSource) {
        try {
            String product = JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getDatabaseProductName);
            return "PostgreSQL".equals(product) ? " COLLATE \"C\"" : "";
        } catch (MetaDataAccessException ex) {
            log.warn("code_collation_unresolved reason={}", ex.getMessage());
            return "";
        }
    }

    private ClassificationPeriodRow mapPeriodRow(ResultSet rs, int rowNum) throws SQLException {
        return new ClassificationPeriodRow(
                rs.getString("functional_code"),
                rs.getString("functional_name"),
                rs.getString("economic_code"),
                rs.getString("economic_name"),
                rs.getInt("report_year"),
                rs.getBigDecimal("amount"),
                rs.getLong("item_count")
        );
    }

    private AggregatedClassification mapAggregated(ResultSet rs, int rowNum) throws SQLException {
        return new AggregatedClassification(
                new ClassificationKey(rs.getString("functional_code"), rs.getString("economic_code")),
                rs.getString("functional_name"),
                rs.getString("economic_name"),
                rs.getBigDecimal("amount"),
                rs.getLong("item_count")
        );
    }
}
