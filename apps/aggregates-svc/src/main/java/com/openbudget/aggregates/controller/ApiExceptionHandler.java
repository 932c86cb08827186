package com.openbudget.aggregates.controller;

import com.openbudget.aggregates.analytics.AggregationError;
import com.openbudget.aggregates.controller.dto.ErrorResponseDto;
import com.openbudget.aggregates.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return requestError(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fieldError.getField(), String.valueOf(fieldError.getDefaultMessage()));
        }
        return requestError(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request body failed validation", Map.of("fields", fields));
    }

    @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return requestError(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(AggregationFailureException.class)
    public ResponseEntity<ErrorResponseDto> handleAggregationFailure(AggregationFailureException ex) {
        AggregationError error = ex.error();
        HttpStatus status = switch (error.kind()) {
            case DATABASE_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT_ERROR -> HttpStatus.GATEWAY_TIMEOUT;
            case NORMALIZATION_DATA_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status)
                .body(ErrorResponseDto.fromAggregationError(error, currentTraceId()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("unhandled_exception type={} message={}", ex.getClass().getSimpleName(), ex.getMessage(), ex);
        return requestError(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error");
    }

    private ResponseEntity<ErrorResponseDto> requestError(HttpStatus status, String code, String message) {
        return requestError(status, code, message, Map.of());
    }

    private ResponseEntity<ErrorResponseDto> requestError(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .body(ErrorResponseDto.requestError(code, message, details, currentTraceId()));
    }

    private static String currentTraceId() {
        return RequestContextHolder.traceId().orElse(null);
    }
}
