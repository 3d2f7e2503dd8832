package com.flagship.mill_sync.transaction;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Human-readable transaction numbers: {@code BUY-yyyyMMdd-NNNN} and
 * {@code SELL-yyyyMMdd-NNNN}, counted per day and type.
 */
@Component
@RequiredArgsConstructor
public class TransactionNumberGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final TransactionRepository repository;
    private final Clock clock;

    public String next(TransactionType type) {
        String prefix = type.name() + "-" + LocalDate.now(clock).format(DAY) + "-";
        long sequence = repository.countByTransactionNumberStartingWith(prefix) + 1;
        return prefix + String.format("%04d", sequence);
    }
}
