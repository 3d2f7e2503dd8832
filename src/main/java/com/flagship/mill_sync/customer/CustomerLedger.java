package com.flagship.mill_sync.customer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.LocalIdAllocator;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationPriority;
import com.flagship.mill_sync.queue.MutationRecord;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.CustomerPayload;
import com.flagship.mill_sync.queue.payload.DeletePayload;
import com.flagship.mill_sync.sync.EntityLedger;
import com.flagship.mill_sync.sync.RemoteFields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class CustomerLedger implements EntityLedger {

    private final CustomerRepository repository;
    private final SyncQueueService syncQueue;
    private final LocalIdAllocator idAllocator;
    private final Clock clock;

    @Override
    public EntityType entityType() {
        return EntityType.CUSTOMER;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findServerId(long localId) {
        return repository.findById(localId).map(CustomerEntity::getServerId);
    }

    @Override
    @Transactional
    public void applySuccess(MutationRecord record, String remoteId, JsonNode canonical) {
        if (record.getOperation() != MutationOperation.CREATE) {
            return;
        }
        repository.findById(record.getEntityId()).ifPresent(customer -> {
            if (!customer.assignServerId(remoteId) && !remoteId.equals(customer.getServerId())) {
                log.warn("Customer {} keeps server id {}, reply carried {}",
                        customer.getLocalId(), customer.getServerId(), remoteId);
            }
        });
    }

    @Override
    @Transactional
    public void updateSyncStatus(long localId, SyncStatus status) {
        repository.findById(localId).ifPresent(customer -> customer.markSyncStatus(status, clock.instant()));
    }

    @Override
    @Transactional
    public int repairMissingMutations() {
        int enqueued = 0;
        for (CustomerEntity customer : repository.findBySyncStatusNot(SyncStatus.SYNCED)) {
            EntityRef ref = EntityRef.of(EntityType.CUSTOMER, customer.getLocalId());
            if (syncQueue.hasOutstanding(ref)) {
                continue;
            }
            if (customer.isDeleted() && customer.getServerId() == null) {
                customer.markSyncStatus(SyncStatus.SYNCED, clock.instant());
                continue;
            }
            if (customer.isDeleted()) {
                syncQueue.enqueue(ref, customer.getServerId(), MutationOperation.DELETE, MutationPriority.NORMAL,
                        new DeletePayload(customer.getUpdatedAt()));
            } else {
                MutationOperation operation = customer.getServerId() == null
                        ? MutationOperation.CREATE
                        : MutationOperation.UPDATE;
                syncQueue.enqueue(ref, customer.getServerId(), operation, MutationPriority.NORMAL,
                        CustomerPayload.from(customer));
            }
            enqueued++;
        }
        return enqueued;
    }

    @Override
    public Optional<String> pullPath() {
        return Optional.of("/customers");
    }

    @Override
    @Transactional
    public boolean applyRemote(JsonNode remote) {
        String serverId = RemoteFields.text(remote, "id");
        if (serverId == null) {
            return false;
        }
        Instant now = clock.instant();
        Instant remoteUpdatedAt = Optional.ofNullable(RemoteFields.instant(remote, "updated_at")).orElse(now);
        boolean remoteDeleted = Boolean.TRUE.equals(RemoteFields.bool(remote, "is_deleted"));
        CustomerDetails details = detailsOf(remote);
        BigDecimal balance = RemoteFields.decimal(remote, "balance");

        Optional<CustomerEntity> existing = repository.findByServerId(serverId);
        if (existing.isEmpty()) {
            if (remoteDeleted || details.getName() == null || details.getPhone() == null) {
                return false;
            }
            CustomerEntity customer = new CustomerEntity(idAllocator.nextId(), now, details);
            customer.assignServerId(serverId);
            customer.applyRemote(details, balance, remoteUpdatedAt, now);
            repository.save(customer);
            log.debug("Pulled new customer {} as local {}", serverId, customer.getLocalId());
            return true;
        }

        CustomerEntity customer = existing.get();
        if (syncQueue.hasOutstanding(EntityRef.of(EntityType.CUSTOMER, customer.getLocalId()))) {
            log.debug("Customer {} has local changes in flight, remote version ignored", customer.getLocalId());
            return false;
        }
        if (!remoteUpdatedAt.isAfter(customer.getUpdatedAt())) {
            return false;
        }
        if (remoteDeleted && !customer.isDeleted()) {
            customer.markDeleted(now);
        }
        customer.applyRemote(merge(customer, details), balance, remoteUpdatedAt, now);
        return true;
    }

    private static CustomerDetails detailsOf(JsonNode remote) {
        Boolean active = RemoteFields.bool(remote, "is_active");
        if (active == null) {
            active = RemoteFields.bool(remote, "active");
        }
        return CustomerDetails.builder()
                .name(RemoteFields.text(remote, "name"))
                .phone(RemoteFields.text(remote, "phone"))
                .secondaryPhone(RemoteFields.text(remote, "secondary_phone"))
                .address(RemoteFields.text(remote, "address"))
                .nicNumber(RemoteFields.text(remote, "nic_number"))
                .customerType(RemoteFields.enumValue(remote, "customer_type", CustomerType.class))
                .active(active == null || active)
                .build();
    }

    /**
     * Fields the remote left out keep their local value.
     */
    private static CustomerDetails merge(CustomerEntity local, CustomerDetails remote) {
        return CustomerDetails.builder()
                .name(remote.getName() != null ? remote.getName() : local.getName())
                .phone(remote.getPhone() != null ? remote.getPhone() : local.getPhone())
                .secondaryPhone(remote.getSecondaryPhone())
                .address(remote.getAddress())
                .nicNumber(remote.getNicNumber())
                .customerType(remote.getCustomerType() != null ? remote.getCustomerType() : local.getCustomerType())
                .active(remote.isActive())
                .build();
    }
}
