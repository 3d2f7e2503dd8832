package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.customer.CustomerEntity;
import com.flagship.mill_sync.customer.CustomerType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class CustomerResponse {

    @JsonProperty("local_id")
    long localId;

    @JsonProperty("server_id")
    String serverId;

    @JsonProperty("name")
    String name;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("secondary_phone")
    String secondaryPhone;

    @JsonProperty("address")
    String address;

    @JsonProperty("nic_number")
    String nicNumber;

    @JsonProperty("customer_type")
    CustomerType customerType;

    @JsonProperty("total_purchases")
    BigDecimal totalPurchases;

    @JsonProperty("total_sales")
    BigDecimal totalSales;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("sync_status")
    SyncStatus syncStatus;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static CustomerResponse from(CustomerEntity customer) {
        return CustomerResponse.builder()
                .localId(customer.getLocalId())
                .serverId(customer.getServerId())
                .name(customer.getName())
                .phone(customer.getPhone())
                .secondaryPhone(customer.getSecondaryPhone())
                .address(customer.getAddress())
                .nicNumber(customer.getNicNumber())
                .customerType(customer.getCustomerType())
                .totalPurchases(customer.getTotalPurchases())
                .totalSales(customer.getTotalSales())
                .balance(customer.getBalance())
                .active(customer.isActive())
                .syncStatus(customer.getSyncStatus())
                .updatedAt(customer.getUpdatedAt())
                .build();
    }
}
