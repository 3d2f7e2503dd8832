package com.flagship.mill_sync.common;

/**
 * A local precondition failed. Nothing was written and nothing was enqueued.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
