package com.flagship.mill_sync.config;

import com.flagship.mill_sync.common.LocalIdAllocator;
import com.flagship.mill_sync.common.SequenceLocalIdAllocator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.support.incrementer.H2SequenceMaxValueIncrementer;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Local store wiring: the clock every component reads time from, and the
 * sequence-backed id allocators for ledger rows and queue ordering.
 */
@Configuration
public class PersistenceConfig {

    public static final String LEDGER_ID_ALLOCATOR = "ledgerIdAllocator";
    public static final String MUTATION_SEQUENCE_ALLOCATOR = "mutationSequenceAllocator";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(LEDGER_ID_ALLOCATOR)
    @Primary
    public LocalIdAllocator ledgerIdAllocator(DataSource dataSource) {
        return new SequenceLocalIdAllocator(new H2SequenceMaxValueIncrementer(dataSource, "local_id_seq"));
    }

    @Bean(MUTATION_SEQUENCE_ALLOCATOR)
    public LocalIdAllocator mutationSequenceAllocator(DataSource dataSource) {
        return new SequenceLocalIdAllocator(new H2SequenceMaxValueIncrementer(dataSource, "mutation_seq"));
    }
}
