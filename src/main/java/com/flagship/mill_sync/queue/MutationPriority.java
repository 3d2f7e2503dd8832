package com.flagship.mill_sync.queue;

/**
 * Drain-order hint. Never affects correctness, only which eligible records
 * go first.
 */
public enum MutationPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2),
    CRITICAL(3);

    private final int rank;

    MutationPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
