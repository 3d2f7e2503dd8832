package com.flagship.mill_sync.remote;

import lombok.Value;

import java.time.Instant;

@Value
public class ConnectivityChangedEvent {
    boolean online;
    Instant changedAt;
}
