package com.flagship.mill_sync.sync;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the {@link EntityLedger} for an entity type.
 */
@Component
public class LedgerRegistry {

    private final Map<EntityType, EntityLedger> ledgers = new EnumMap<>(EntityType.class);

    public LedgerRegistry(List<EntityLedger> ledgers) {
        for (EntityLedger ledger : ledgers) {
            EntityLedger previous = this.ledgers.put(ledger.entityType(), ledger);
            if (previous != null) {
                throw new IllegalStateException("Two ledgers registered for " + ledger.entityType());
            }
        }
    }

    public EntityLedger get(EntityType type) {
        EntityLedger ledger = ledgers.get(type);
        if (ledger == null) {
            throw new IllegalStateException("No ledger registered for " + type);
        }
        return ledger;
    }

    public Optional<String> serverIdOf(EntityRef ref) {
        EntityLedger ledger = ledgers.get(ref.getType());
        return ledger == null ? Optional.empty() : ledger.findServerId(ref.getLocalId());
    }

    public Collection<EntityLedger> all() {
        return Collections.unmodifiableCollection(ledgers.values());
    }
}
