package com.flagship.mill_sync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.Value;

/**
 * Successful remote reply. {@code data} is the unwrapped payload, never null.
 */
@Value
public class RemoteResponse {
    boolean success;
    int statusCode;
    JsonNode data;
    String message;

    public static RemoteResponse ok(JsonNode data) {
        return new RemoteResponse(true, 200, data != null ? data : NullNode.getInstance(), null);
    }

    public static RemoteResponse of(int statusCode, JsonNode data, String message) {
        return new RemoteResponse(true, statusCode, data != null ? data : NullNode.getInstance(), message);
    }

    /**
     * Text value of a top-level field of the data, or null.
     */
    public String text(String field) {
        JsonNode node = data.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
