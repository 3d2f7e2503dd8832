package com.flagship.mill_sync.queue.payload;

import com.flagship.mill_sync.customer.CustomerEntity;
import com.flagship.mill_sync.customer.CustomerType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class CustomerPayload implements MutationPayload {
    String name;
    String phone;
    String secondaryPhone;
    String address;
    String nicNumber;
    CustomerType customerType;
    BigDecimal balance;
    BigDecimal totalPurchases;
    BigDecimal totalSales;
    boolean active;
    Instant updatedAt;

    public static CustomerPayload from(CustomerEntity customer) {
        return new CustomerPayload(
                customer.getName(),
                customer.getPhone(),
                customer.getSecondaryPhone(),
                customer.getAddress(),
                customer.getNicNumber(),
                customer.getCustomerType(),
                customer.getBalance(),
                customer.getTotalPurchases(),
                customer.getTotalSales(),
                customer.isActive(),
                customer.getUpdatedAt());
    }

    @Override
    public boolean isSnapshot() {
        return true;
    }
}
