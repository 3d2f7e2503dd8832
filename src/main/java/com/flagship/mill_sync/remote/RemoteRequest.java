package com.flagship.mill_sync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;
import org.springframework.http.HttpMethod;

/**
 * One call to the remote system of record.
 *
 * The idempotency key lets the remote drop a duplicate delivery of the same
 * mutation. A delete of something already gone on the remote is
 * {@code notFoundIsSuccess}.
 */
@Value
public class RemoteRequest {
    HttpMethod method;
    String path;
    JsonNode body;
    String idempotencyKey;
    boolean notFoundIsSuccess;

    public static RemoteRequest get(String path) {
        return new RemoteRequest(HttpMethod.GET, path, null, null, false);
    }

    public static RemoteRequest post(String path, JsonNode body, String idempotencyKey) {
        return new RemoteRequest(HttpMethod.POST, path, body, idempotencyKey, false);
    }

    public static RemoteRequest put(String path, JsonNode body, String idempotencyKey) {
        return new RemoteRequest(HttpMethod.PUT, path, body, idempotencyKey, false);
    }

    public static RemoteRequest delete(String path, String idempotencyKey) {
        return new RemoteRequest(HttpMethod.DELETE, path, null, idempotencyKey, true);
    }
}
