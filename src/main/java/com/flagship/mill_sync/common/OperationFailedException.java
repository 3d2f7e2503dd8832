package com.flagship.mill_sync.common;

import lombok.Getter;

/**
 * Raised when a failed {@link OperationResult} is unwrapped.
 */
@Getter
public class OperationFailedException extends RuntimeException {

    private final Failure failure;

    public OperationFailedException(Failure failure) {
        super(failure.getMessage());
        this.failure = failure;
    }
}
