package com.flagship.mill_sync.remote;

import com.flagship.mill_sync.config.SyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Last connectivity state reported by the device shell. A change publishes
 * a {@link ConnectivityChangedEvent}.
 */
@Component
@Slf4j
public class ConnectivityMonitor {

    private final AtomicBoolean online;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ConnectivityMonitor(SyncProperties properties, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.online = new AtomicBoolean(properties.isAssumeOnline());
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public boolean isOnline() {
        return online.get();
    }

    public void reportConnectivity(boolean nowOnline) {
        boolean previous = online.getAndSet(nowOnline);
        if (previous != nowOnline) {
            log.info("Connectivity changed: {}", nowOnline ? "online" : "offline");
            eventPublisher.publishEvent(new ConnectivityChangedEvent(nowOnline, clock.instant()));
        }
    }
}
