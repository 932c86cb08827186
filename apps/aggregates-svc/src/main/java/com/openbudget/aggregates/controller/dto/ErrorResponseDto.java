package com.openbudget.aggregates.controller.dto;

import com.openbudget.aggregates.analytics.AggregationError;
import java.util.Map;

/**
 * Error body shared by every endpoint. {@code retryable} tells callers whether repeating the same
 * request may succeed; request errors are never retryable.
 */
public record ErrorResponseDto(String code, String message, boolean retryable, Map<String, Object> details, String traceId) {

    public ErrorResponseDto {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ErrorResponseDto requestError(String code, String message, Map<String, Object> details, String traceId) {
        return new ErrorResponseDto(code, message, false, details, traceId);
    }

    public static ErrorResponseDto fromAggregationError(AggregationError error, String traceId) {
        return new ErrorResponseDto(
                error.kind().name(),
                error.message(),
                error.retryable(),
                Map.of(),
                traceId);
    }
}
