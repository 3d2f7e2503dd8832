package com.flagship.mill_sync.common;

import lombok.Value;

/**
 * Describes why an operation or a remote call did not succeed.
 */
@Value
public class Failure {
    FailureType type;
    String message;
    Integer statusCode;

    public static Failure of(FailureType type, String message) {
        return new Failure(type, message, null);
    }

    public static Failure of(FailureType type, String message, int statusCode) {
        return new Failure(type, message, statusCode);
    }
}
