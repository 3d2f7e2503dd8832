package com.flagship.mill_sync.common;

import org.springframework.jdbc.support.incrementer.DataFieldMaxValueIncrementer;

/**
 * {@link LocalIdAllocator} backed by a database sequence.
 */
public class SequenceLocalIdAllocator implements LocalIdAllocator {

    private final DataFieldMaxValueIncrementer incrementer;

    public SequenceLocalIdAllocator(DataFieldMaxValueIncrementer incrementer) {
        this.incrementer = incrementer;
    }

    @Override
    public long nextId() {
        return incrementer.nextLongValue();
    }
}
