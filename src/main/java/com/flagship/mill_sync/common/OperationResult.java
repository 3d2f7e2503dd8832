package com.flagship.mill_sync.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.function.Function;

/**
 * Outcome of a call through the sync API: either a value or a {@link Failure}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult<T> {
    T value;
    Failure failure;

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null);
    }

    public static <T> OperationResult<T> failure(Failure failure) {
        return new OperationResult<>(null, failure);
    }

    public static <T> OperationResult<T> failure(FailureType type, String message) {
        return new OperationResult<>(null, Failure.of(type, message));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Returns the value, or throws {@link OperationFailedException} carrying the failure.
     */
    public T getOrThrow() {
        if (failure != null) {
            throw new OperationFailedException(failure);
        }
        return value;
    }

    public <R> OperationResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(failure);
    }
}
