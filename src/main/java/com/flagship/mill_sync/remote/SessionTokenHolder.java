package com.flagship.mill_sync.remote;

import com.flagship.mill_sync.config.SyncProperties;
import org.springframework.stereotype.Component;

/**
 * Bearer token for the remote. Seeded from configuration and replaced when
 * the shell signs in again.
 */
@Component
public class SessionTokenHolder {

    private volatile String token;

    public SessionTokenHolder(SyncProperties properties) {
        this.token = properties.getRemote().getAccessToken();
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public boolean hasToken() {
        String current = token;
        return current != null && !current.isBlank();
    }
}
