package com.flagship.mill_sync.customer;

import com.flagship.mill_sync.common.EntityNotFoundException;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.LocalIdAllocator;
import com.flagship.mill_sync.common.ValidationException;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationPriority;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.CustomerPayload;
import com.flagship.mill_sync.queue.payload.DeletePayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Customer create, update and soft delete.
 *
 * Phone numbers are unique among customers that are not deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerService {

    private final CustomerRepository repository;
    private final SyncQueueService syncQueue;
    private final LocalIdAllocator idAllocator;
    private final Clock clock;

    @Transactional
    public CustomerEntity createCustomer(CustomerDetails details) {
        validate(details);
        if (repository.existsByPhoneAndDeletedFalse(details.getPhone())) {
            throw new ValidationException("A customer with phone " + details.getPhone() + " already exists");
        }

        CustomerEntity customer = new CustomerEntity(idAllocator.nextId(), clock.instant(), details);
        repository.save(customer);

        syncQueue.enqueue(ref(customer), null, MutationOperation.CREATE, MutationPriority.NORMAL,
                CustomerPayload.from(customer));

        log.info("Created customer {}: name={}, type={}", customer.getLocalId(), customer.getName(),
                customer.getCustomerType());
        return customer;
    }

    @Transactional
    public CustomerEntity updateCustomer(long customerId, CustomerDetails details) {
        validate(details);
        CustomerEntity customer = loadActive(customerId);
        if (repository.existsByPhoneAndDeletedFalseAndLocalIdNot(details.getPhone(), customerId)) {
            throw new ValidationException("A customer with phone " + details.getPhone() + " already exists");
        }

        customer.updateDetails(details, clock.instant());

        syncQueue.enqueue(ref(customer), customer.getServerId(), MutationOperation.UPDATE, MutationPriority.NORMAL,
                CustomerPayload.from(customer));

        log.info("Updated customer {}", customerId);
        return customer;
    }

    /**
     * Soft delete. The row stays as a tombstone until the delete is confirmed
     * by the remote.
     */
    @Transactional
    public void deleteCustomer(long customerId) {
        CustomerEntity customer = loadActive(customerId);
        Instant now = clock.instant();
        customer.markDeleted(now);

        syncQueue.enqueue(ref(customer), customer.getServerId(), MutationOperation.DELETE, MutationPriority.NORMAL,
                new DeletePayload(now));

        log.info("Deleted customer {}", customerId);
    }

    @Transactional(readOnly = true)
    public Optional<CustomerEntity> findById(long customerId) {
        return repository.findById(customerId);
    }

    @Transactional(readOnly = true)
    public List<CustomerEntity> findAll() {
        return repository.findByDeletedFalseOrderByNameAsc();
    }

    private CustomerEntity loadActive(long customerId) {
        CustomerEntity customer = repository.findById(customerId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.CUSTOMER, customerId));
        if (customer.isDeleted()) {
            throw new EntityNotFoundException(EntityType.CUSTOMER, customerId);
        }
        return customer;
    }

    private static void validate(CustomerDetails details) {
        if (details.getName() == null || details.getName().isBlank()) {
            throw new ValidationException("Customer name is required");
        }
        if (details.getPhone() == null || details.getPhone().isBlank()) {
            throw new ValidationException("Customer phone is required");
        }
    }

    private static EntityRef ref(CustomerEntity customer) {
        return EntityRef.of(EntityType.CUSTOMER, customer.getLocalId());
    }
}
