package com.openbudget.aggregates.population;

import com.openbudget.aggregates.analytics.AggregationError;
import com.openbudget.aggregates.analytics.AggregationResult;
import com.openbudget.aggregates.model.AnalyticsFilter;
import java.math.BigDecimal;
import java.util.List;
import javax.sql.DataSource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public class JdbcPopulationRepository implements PopulationRepository {

    private static final String COUNTY_UNIT_CONDITION = """
            ((u.county_code = :bucharestCounty AND u.siruta_code = :bucharestSiruta)
              OR (u.county_code <> :bucharestCounty AND u.siruta_code = u.county_code))
            """;

    private static final String COUNTRY_SQL = """
            SELECT COALESCE(SUM(u.population), 0)
            FROM uats u
            WHERE %s
            """.formatted(COUNTY_UNIT_CONDITION);

    private static final String COUNTIES_SQL = """
            SELECT COALESCE(SUM(u.population), 0)
            FROM uats u
            WHERE u.county_code IN (:countyCodes)
              AND %s
            """.formatted(COUNTY_UNIT_CONDITION);

    private static final String UAT_IDS_SQL = """
            SELECT COALESCE(SUM(u.population), 0)
            FROM uats u
            WHERE u.id IN (:uatIds)
            """;

    private static final String COUNCIL_COUNTIES_SQL = """
            SELECT DISTINCT u.county_code
            FROM entities e
            JOIN uats u ON e.uat_id = u.id
            WHERE e.entity_type = :councilType
            """;

    // Distinct units first so two entities sharing a UAT count it once.
    private static final String ENTITY_UNITS_SQL = """
            SELECT COALESCE(SUM(units.population), 0)
            FROM (
                SELECT DISTINCT u.id, u.population
                FROM entities e
                JOIN uats u ON e.uat_id = u.id
                WHERE %s
            ) units
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcPopulationRepository(DataSource dataSource, int queryTimeoutSeconds) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        template.setQueryTimeout(queryTimeoutSeconds);
        this.jdbcTemplate = new NamedParameterJdbcTemplate(template);
    }

    @Override
    public AggregationResult<BigDecimal> getCountryPopulation() {
        try {
            return AggregationResult.ok(single(COUNTRY_SQL, countyParams()));
        } catch (DataAccessException ex) {
            return AggregationResult.failure(AggregationError.fromDataAccess("Failed to fetch country population", ex));
        }
    }

    @Override
    public AggregationResult<BigDecimal> getFilteredPopulation(AnalyticsFilter filter) {
        try {
            return AggregationResult.ok(filteredPopulation(filter));
        } catch (DataAccessException ex) {
            return AggregationResult.failure(AggregationError.fromDataAccess("Failed to fetch filtered population", ex));
        }
    }

    private BigDecimal filteredPopulation(AnalyticsFilter filter) {
        if (!filter.entityCuis().isEmpty()) {
            return single(ENTITY_UNITS_SQL.formatted("e.cui IN (:cuis)"),
                    new MapSqlParameterSource("cuis", filter.entityCuis()));
        }
        if (!filter.uatIds().isEmpty()) {
            return single(UAT_IDS_SQL, new MapSqlParameterSource("uatIds", filter.uatIds()));
        }
        if (!filter.countyCodes().isEmpty()) {
            return byCounties(filter.countyCodes());
        }
        if (!filter.entityTypes().isEmpty()) {
            if (filter.entityTypes().contains(COUNTY_COUNCIL_ENTITY_TYPE)) {
                List<String> counties = jdbcTemplate.queryForList(COUNCIL_COUNTIES_SQL,
                        new MapSqlParameterSource("councilType", COUNTY_COUNCIL_ENTITY_TYPE), String.class);
                return counties.isEmpty() ? BigDecimal.ZERO : byCounties(counties);
            }
            MapSqlParameterSource params = new MapSqlParameterSource("entityTypes", filter.entityTypes());
            String condition = "e.entity_type IN (:entityTypes)";
            if (filter.isUat() != null) {
                condition += " AND e.is_uat = :isUat";
                params.addValue("isUat", filter.isUat());
            }
            return single(ENTITY_UNITS_SQL.formatted(condition), params);
        }
        if (Boolean.TRUE.equals(filter.isUat())) {
            return single(ENTITY_UNITS_SQL.formatted("e.is_uat = TRUE"), new MapSqlParameterSource());
        }
        return single(COUNTRY_SQL, countyParams());
    }

    private BigDecimal byCounties(List<String> countyCodes) {
        MapSqlParameterSource params = countyParams().addValue("countyCodes", countyCodes);
        return single(COUNTIES_SQL, params);
    }

    private BigDecimal single(String sql, MapSqlParameterSource params) {
        BigDecimal value = jdbcTemplate.queryForObject(sql, params, BigDecimal.class);
        return value == null ? BigDecimal.ZERO : value;
    }

    private static MapSqlParameterSource countyParams() {
        return new MapSqlParameterSource()
                .addValue("bucharestCounty", BUCHAREST_COUNTY_CODE)
                .addValue("bucharestSiruta", BUCHAREST_SIRUTA_CODE);
    }
}
