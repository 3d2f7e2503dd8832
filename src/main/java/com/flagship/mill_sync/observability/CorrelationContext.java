package com.flagship.mill_sync.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id and the MDC keys used across the app.
 *
 * HTTP requests get a correlation id; every sync pass gets a pass id, and
 * the record being transmitted is tagged with its id and entity. A pass
 * requested from a request thread carries that request's correlation id
 * and the trigger reason onto the sync thread.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String SYNC_PASS_ID_MDC_KEY = "syncPassId";
    public static final String MUTATION_ID_MDC_KEY = "mutationId";
    public static final String ENTITY_REF_MDC_KEY = "entityRef";
    public static final String SYNC_TRIGGER_MDC_KEY = "syncTrigger";

    private static final String[] MDC_KEYS = {
            CORRELATION_ID_MDC_KEY, SYNC_PASS_ID_MDC_KEY, MUTATION_ID_MDC_KEY, ENTITY_REF_MDC_KEY, SYNC_TRIGGER_MDC_KEY
    };

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation id, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateId());
        }
    }

    /**
     * Correlation id bound to this thread, or null. Unlike
     * {@link #getCorrelationId()} this never generates one.
     */
    public static String currentCorrelationId() {
        return correlationId.get();
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Removes every key this application puts in the MDC.
     */
    public static void clearMdc() {
        for (String key : MDC_KEYS) {
            MDC.remove(key);
        }
    }

    /**
     * Short random id, readable in logs.
     */
    public static String generateId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
