package com.openbudget.aggregates.analytics;

import java.sql.SQLException;
import java.util.Locale;
import org.springframework.dao.QueryTimeoutException;

/**
 * Failure of an aggregation request. Database and timeout failures may be retried by the caller;
 * missing normalization data may not.
 */
public record AggregationError(Kind kind, String message, boolean retryable, Throwable cause) {

    private static final String STATEMENT_TIMEOUT_SQL_STATE = "57014";

    public enum Kind {
        DATABASE_ERROR,
        TIMEOUT_ERROR,
        NORMALIZATION_DATA_ERROR
    }

    public static AggregationError database(String message, Throwable cause) {
        return new AggregationError(Kind.DATABASE_ERROR, message, true, cause);
    }

    public static AggregationError timeout(String message, Throwable cause) {
        return new AggregationError(Kind.TIMEOUT_ERROR, message, true, cause);
    }

    public static AggregationError normalizationData(String message, Throwable cause) {
        return new AggregationError(Kind.NORMALIZATION_DATA_ERROR, message, false, cause);
    }

    /**
     * Classifies a data-access failure, surfacing statement timeouts separately from other errors.
     */
    public static AggregationError fromDataAccess(String message, Throwable cause) {
        if (isTimeout(cause)) {
            return timeout(message + ": query timed out", cause);
        }
        return database(message + ": " + describe(cause), cause);
    }

    static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof QueryTimeoutException) {
                return true;
            }
            if (current instanceof SQLException sql && STATEMENT_TIMEOUT_SQL_STATE.equals(sql.getSQLState())) {
                return true;
            }
            String text = current.getMessage() == null ? "" : current.getMessage().toLowerCase(Locale.ROOT);
            if (text.contains("statement timeout") || text.contains(STATEMENT_TIMEOUT_SQL_STATE)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
