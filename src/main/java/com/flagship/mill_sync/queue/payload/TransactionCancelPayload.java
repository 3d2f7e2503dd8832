package com.flagship.mill_sync.queue.payload;

import lombok.Value;

import java.time.Instant;

@Value
public class TransactionCancelPayload implements MutationPayload {
    String reason;
    Instant cancelledAt;
}
