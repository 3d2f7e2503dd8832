package com.flagship.mill_sync.remote;

public enum RemoteOutcome {
    SUCCESS,
    /** Retry later with backoff. */
    TRANSIENT,
    /** Retrying the same payload can never succeed. */
    SEMANTIC_CONFLICT,
    /** Session must be renewed before anything else is sent. */
    AUTH_REQUIRED,
    /** The call was abandoned locally. */
    CANCELLED
}
