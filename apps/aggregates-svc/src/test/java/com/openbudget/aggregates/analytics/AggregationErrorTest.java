package com.openbudget.aggregates.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.UncategorizedSQLException;

class AggregationErrorTest {

    @Test
    void queryTimeoutIsClassifiedAsTimeout() {
        AggregationError error = AggregationError.fromDataAccess("Failed to fetch aggregated line items", new QueryTimeoutException("timed out"));

        assertThat(error.kind()).isEqualTo(AggregationError.Kind.TIMEOUT_ERROR);
        assertThat(error.retryable()).isTrue();
    }

    @Test
    void postgresCancelSqlStateIsClassifiedAsTimeout() {
        SQLException cancelled = new SQLException("ERROR: canceling statement due to user request", "57014");
        AggregationError error = AggregationError.fromDataAccess("Failed", new UncategorizedSQLException("query", "SELECT 1", cancelled));

        assertThat(error.kind()).isEqualTo(AggregationError.Kind.TIMEOUT_ERROR);
    }

    @Test
    void otherFailuresAreRetryableDatabaseErrors() {
        AggregationError error = AggregationError.fromDataAccess("Failed", new DataAccessResourceFailureException("connection refused"));

        assertThat(error.kind()).isEqualTo(AggregationError.Kind.DATABASE_ERROR);
        assertThat(error.retryable()).isTrue();
        assertThat(error.message()).isEqualTo("Failed: connection refused");
    }

    @Test
    void resultMapsValuesAndKeepsErrors() {
        AggregationError error = AggregationError.normalizationData("missing", null);

        assertThat(AggregationResult.ok(2).map(value -> value * 10).value()).isEqualTo(20);
        assertThat(AggregationResult.<Integer>failure(error).map(value -> value * 10).error()).isSameAs(error);
        assertThat(error.retryable()).isFalse();
    }
}
