package com.flagship.mill_sync.api;

import com.flagship.mill_sync.api.dto.CustomerRequest;
import com.flagship.mill_sync.api.dto.CustomerResponse;
import com.flagship.mill_sync.customer.CustomerEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
@Slf4j
public class CustomerController {

    private final SyncFacade syncFacade;

    @PostMapping
    public ResponseEntity<CustomerResponse> createCustomer(@Valid @RequestBody CustomerRequest request) {
        log.info("Received customer creation request: name={}, type={}", request.getName(), request.getCustomerType());
        CustomerEntity customer = syncFacade.createCustomer(request.toDetails()).getOrThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(CustomerResponse.from(customer));
    }

    @PutMapping("/{id}")
    public ResponseEntity<CustomerResponse> updateCustomer(@PathVariable("id") long id,
                                                           @Valid @RequestBody CustomerRequest request) {
        CustomerEntity customer = syncFacade.updateCustomer(id, request.toDetails()).getOrThrow();
        return ResponseEntity.ok(CustomerResponse.from(customer));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteCustomer(@PathVariable("id") long id) {
        syncFacade.deleteCustomer(id).getOrThrow();
        return ResponseEntity.noContent().build();
    }
}
