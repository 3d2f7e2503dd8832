package com.flagship.mill_sync.queue;

import com.flagship.mill_sync.common.EntityRef;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logical per-entity lock held while a record of that entity is in flight.
 * Non-blocking: a busy entity is skipped, never waited for.
 */
@Component
public class EntityLockRegistry {

    private final Set<EntityRef> inFlight = ConcurrentHashMap.newKeySet();

    public boolean tryLock(EntityRef entity) {
        return inFlight.add(entity);
    }

    public void unlock(EntityRef entity) {
        inFlight.remove(entity);
    }

    public boolean isLocked(EntityRef entity) {
        return inFlight.contains(entity);
    }
}
