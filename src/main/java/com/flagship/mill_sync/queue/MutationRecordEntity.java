package com.flagship.mill_sync.queue;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA entity for mutation records. The payload is stored as tagged JSON and
 * dependencies as a comma separated list of {@code TYPE:localId}.
 */
@Entity
@Table(name = "mutation_records")
@Getter
@Setter
@NoArgsConstructor
public class MutationRecordEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 16)
    private EntityType entityType;

    @Column(name = "entity_id", nullable = false)
    private long entityId;

    @Column(name = "entity_server_id", length = 64)
    private String entityServerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation", nullable = false, length = 8)
    private MutationOperation operation;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SyncStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    private MutationPriority priority;

    @Lob
    @Column(name = "payload", nullable = false)
    private String payload;

    @Column(name = "dependencies", length = 2000)
    private String dependencies;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    /**
     * Creates an entity from a domain object.
     */
    public static MutationRecordEntity fromDomain(MutationRecord record, MutationPayloadCodec codec) {
        MutationRecordEntity entity = new MutationRecordEntity();
        entity.setId(record.getId());
        entity.setSequenceNumber(record.getSequenceNumber());
        entity.setEntityType(record.getEntityType());
        entity.setEntityId(record.getEntityId());
        entity.setCreatedAt(record.getCreatedAt());
        entity.apply(record, codec);
        return entity;
    }

    /**
     * Copies the mutable state of a transitioned domain record onto this row.
     */
    public void apply(MutationRecord record, MutationPayloadCodec codec) {
        this.entityServerId = record.getEntityServerId();
        this.operation = record.getOperation();
        this.status = record.getStatus();
        this.priority = record.getPriority();
        this.payload = codec.encode(record.getPayload());
        this.dependencies = formatDependencies(record.getDependencies());
        this.errorMessage = truncate(record.getErrorMessage());
        this.retryCount = record.getRetryCount();
        this.maxRetries = record.getMaxRetries();
        this.lastAttemptAt = record.getLastAttemptAt();
        this.nextRetryAt = record.getNextRetryAt();
        this.updatedAt = record.getUpdatedAt();
    }

    /**
     * Converts this entity to a domain object.
     */
    public MutationRecord toDomain(MutationPayloadCodec codec) {
        return MutationRecord.builder()
                .id(id)
                .sequenceNumber(sequenceNumber)
                .entityType(entityType)
                .entityId(entityId)
                .entityServerId(entityServerId)
                .operation(operation)
                .status(status)
                .priority(priority)
                .payload(codec.decode(payload))
                .dependencies(parseDependencies(dependencies))
                .errorMessage(errorMessage)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .lastAttemptAt(lastAttemptAt)
                .nextRetryAt(nextRetryAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    private static String formatDependencies(List<EntityRef> refs) {
        if (refs == null || refs.isEmpty()) {
            return null;
        }
        return refs.stream().map(EntityRef::format).collect(Collectors.joining(","));
    }

    private static List<EntityRef> parseDependencies(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(",")).map(EntityRef::parse).toList();
    }

    private static String truncate(String message) {
        return message != null && message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}
