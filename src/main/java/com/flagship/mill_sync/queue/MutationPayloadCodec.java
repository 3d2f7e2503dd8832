package com.flagship.mill_sync.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.mill_sync.queue.payload.MutationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Serializes payloads at the queue boundary. Nothing above the queue sees
 * the JSON form.
 */
@Component
@RequiredArgsConstructor
public class MutationPayloadCodec {

    private final ObjectMapper objectMapper;

    public String encode(MutationPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize mutation payload", e);
        }
    }

    public MutationPayload decode(String json) {
        try {
            return objectMapper.readValue(json, MutationPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored mutation payload is unreadable", e);
        }
    }
}
