package com.flagship.mill_sync.queue.payload;

import lombok.Value;

import java.time.Instant;

@Value
public class DeletePayload implements MutationPayload {
    Instant deletedAt;
}
