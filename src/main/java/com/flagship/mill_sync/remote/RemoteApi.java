package com.flagship.mill_sync.remote;

/**
 * The remote system of record, as seen by the sync engine.
 */
public interface RemoteApi {

    /**
     * Sends one request. Never throws: transport and HTTP errors come back
     * as a failed {@link RemoteResult}.
     */
    RemoteResult send(RemoteRequest request);
}
