package com.flagship.mill_sync.api;

import com.flagship.mill_sync.api.dto.CancelTransactionRequest;
import com.flagship.mill_sync.api.dto.CreateTransactionRequest;
import com.flagship.mill_sync.api.dto.PaymentResponse;
import com.flagship.mill_sync.api.dto.RecordPaymentRequest;
import com.flagship.mill_sync.api.dto.TransactionResponse;
import com.flagship.mill_sync.payment.PaymentEntity;
import com.flagship.mill_sync.transaction.TransactionEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Buy, sell, cancel and settle. Each call returns once the local write and
 * its queued mutations are committed.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final SyncFacade syncFacade;

    @PostMapping("/buy")
    public ResponseEntity<TransactionResponse> buy(@Valid @RequestBody CreateTransactionRequest request) {
        log.info("Received buy request: customer={}, lines={}", request.getCustomerId(), request.getItems().size());
        TransactionEntity transaction = syncFacade.createBuyTransaction(request.toCommand()).getOrThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @PostMapping("/sell")
    public ResponseEntity<TransactionResponse> sell(@Valid @RequestBody CreateTransactionRequest request) {
        log.info("Received sell request: customer={}, lines={}", request.getCustomerId(), request.getItems().size());
        TransactionEntity transaction = syncFacade.createSellTransaction(request.toCommand()).getOrThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<TransactionResponse> cancel(@PathVariable("id") long id,
                                                      @Valid @RequestBody CancelTransactionRequest request) {
        log.info("Received cancel request: transaction={}", id);
        TransactionEntity transaction = syncFacade.cancelTransaction(id, request.getReason()).getOrThrow();
        return ResponseEntity.ok(TransactionResponse.from(transaction));
    }

    @PostMapping("/{id}/payments")
    public ResponseEntity<PaymentResponse> recordPayment(@PathVariable("id") long id,
                                                         @Valid @RequestBody RecordPaymentRequest request) {
        log.info("Received payment: transaction={}, amount={}", id, request.getAmount());
        PaymentEntity payment = syncFacade.recordPayment(id, request.getAmount(), request.getPaymentMethod(),
                request.getNotes()).getOrThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }
}
