package com.flagship.mill_sync.payment;

import com.flagship.mill_sync.common.EntityNotFoundException;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.LocalIdAllocator;
import com.flagship.mill_sync.common.ValidationException;
import com.flagship.mill_sync.customer.CustomerEntity;
import com.flagship.mill_sync.customer.CustomerRepository;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationPriority;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.CustomerPayload;
import com.flagship.mill_sync.queue.payload.PaymentPayload;
import com.flagship.mill_sync.transaction.TransactionEntity;
import com.flagship.mill_sync.transaction.TransactionRepository;
import com.flagship.mill_sync.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Records settlements of an open transaction balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final TransactionRepository transactionRepository;
    private final CustomerRepository customerRepository;
    private final SyncQueueService syncQueue;
    private final LocalIdAllocator idAllocator;
    private final Clock clock;

    /**
     * Records a payment of at most the amount still due. The payment is
     * queued as its own create, sent once the transaction has a server id.
     */
    @Transactional
    public PaymentEntity recordPayment(long transactionId, BigDecimal amount, PaymentMethod method, String notes) {
        TransactionEntity transaction = transactionRepository.findById(transactionId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.TRANSACTION, transactionId));
        if (transaction.isCancelled()) {
            throw new ValidationException("Cannot record a payment on cancelled transaction "
                    + transaction.getTransactionNumber());
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Payment amount must be greater than zero");
        }
        if (amount.compareTo(transaction.getDueAmount()) > 0) {
            throw new ValidationException(String.format("Payment of %s exceeds the amount due (%s)",
                    amount.toPlainString(), transaction.getDueAmount().toPlainString()));
        }
        Instant now = clock.instant();

        PaymentEntity payment = new PaymentEntity(idAllocator.nextId(), now, transactionId, amount, method, notes);
        paymentRepository.save(payment);

        transaction.recordPayment(amount, now);

        CustomerEntity customer = customerRepository.findById(transaction.getCustomerLocalId())
                .orElseThrow(() -> new EntityNotFoundException(EntityType.CUSTOMER, transaction.getCustomerLocalId()));
        customer.applySettlement(amount, transaction.getTransactionType() == TransactionType.BUY, now);

        syncQueue.enqueue(EntityRef.of(EntityType.PAYMENT, payment.getLocalId()), null,
                MutationOperation.CREATE, MutationPriority.HIGH, PaymentPayload.from(payment));
        syncQueue.enqueue(EntityRef.of(EntityType.CUSTOMER, customer.getLocalId()), customer.getServerId(),
                MutationOperation.UPDATE, MutationPriority.NORMAL, CustomerPayload.from(customer));

        log.info("Recorded payment {} of {} on transaction {}, due now {}",
                payment.getLocalId(), amount, transaction.getTransactionNumber(), transaction.getDueAmount());

        return payment;
    }

    @Transactional(readOnly = true)
    public List<PaymentEntity> findForTransaction(long transactionId) {
        return paymentRepository.findByTransactionLocalIdOrderByPaidAtAsc(transactionId);
    }
}
