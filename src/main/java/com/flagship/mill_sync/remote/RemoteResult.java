package com.flagship.mill_sync.remote;

import com.flagship.mill_sync.common.Failure;
import com.flagship.mill_sync.common.FailureType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either a {@link RemoteResponse} or a {@link Failure}. The remote client
 * never throws into the sync engine.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RemoteResult {
    RemoteResponse response;
    Failure failure;

    public static RemoteResult success(RemoteResponse response) {
        return new RemoteResult(response, null);
    }

    public static RemoteResult failure(Failure failure) {
        return new RemoteResult(null, failure);
    }

    public static RemoteResult failure(FailureType type, String message, int statusCode) {
        return new RemoteResult(null, Failure.of(type, message, statusCode));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public String describe() {
        if (isSuccess()) {
            return "success (" + response.getStatusCode() + ")";
        }
        return failure.getStatusCode() != null
                ? failure.getType() + " " + failure.getStatusCode() + ": " + failure.getMessage()
                : failure.getType() + ": " + failure.getMessage();
    }
}
