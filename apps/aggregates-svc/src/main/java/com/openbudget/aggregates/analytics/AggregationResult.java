package com.openbudget.aggregates.analytics;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or an {@link AggregationError}. Failures travel as values so that the service
 * never throws across its boundary.
 */
public final class AggregationResult<T> {

    private final T value;
    private final AggregationError error;

    private AggregationResult(T value, AggregationError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> AggregationResult<T> ok(T value) {
        return new AggregationResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> AggregationResult<T> failure(AggregationError error) {
        return new AggregationResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value present: " + error.kind() + " " + error.message());
        }
        return value;
    }

    public AggregationError error() {
        if (error == null) {
            throw new IllegalStateException("No error present");
        }
        return error;
    }

    public <R> AggregationResult<R> map(Function<? super T, ? extends R> mapper) {
        return isOk() ? ok(mapper.apply(value)) : failure(error);
    }
}
