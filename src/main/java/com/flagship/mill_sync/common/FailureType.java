package com.flagship.mill_sync.common;

/**
 * Failure taxonomy shared by the remote client and the sync API.
 */
public enum FailureType {
    /** Connectivity lost, timeout, throttling. Transient. */
    NETWORK,
    /** Session expired or rejected. */
    AUTH,
    /** Local precondition or server-rejected payload. */
    VALIDATION,
    /** Unexpected 5xx or unreadable response. Transient. */
    SERVER,
    /** Remote state disagrees with the local intent. */
    CONFLICT,
    /** Call abandoned because the engine is shutting down. */
    CANCELLED,
    /** Local persistence error. */
    STORAGE,
    /** Local entity or queue record does not exist. */
    NOT_FOUND
}
