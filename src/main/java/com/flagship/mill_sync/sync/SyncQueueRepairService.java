package com.flagship.mill_sync.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Self-healing before each push: every unsynced ledger row must be
 * described by at least one outstanding mutation record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncQueueRepairService {

    private final LedgerRegistry registry;

    public int repairAll() {
        int repaired = 0;
        for (EntityLedger ledger : registry.all()) {
            try {
                repaired += ledger.repairMissingMutations();
            } catch (Exception e) {
                log.error("Queue repair failed for {}", ledger.entityType(), e);
            }
        }
        if (repaired > 0) {
            log.warn("Re-enqueued {} mutation(s) for unsynced rows without a queue entry", repaired);
        }
        return repaired;
    }
}
