package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.customer.CustomerDetails;
import com.flagship.mill_sync.customer.CustomerType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Body of customer create and update calls.
 */
@Value
public class CustomerRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must be at most 200 characters")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Phone is required")
    @Pattern(regexp = "^[0-9+ ]{7,20}$", message = "Phone must be 7 to 20 digits")
    @JsonProperty("phone")
    String phone;

    @JsonProperty("secondary_phone")
    String secondaryPhone;

    @JsonProperty("address")
    String address;

    @JsonProperty("nic_number")
    String nicNumber;

    @NotNull(message = "Customer type is required")
    @JsonProperty("customer_type")
    CustomerType customerType;

    @JsonProperty("is_active")
    Boolean active;

    public CustomerDetails toDetails() {
        return CustomerDetails.builder()
                .name(name)
                .phone(phone)
                .secondaryPhone(secondaryPhone)
                .address(address)
                .nicNumber(nicNumber)
                .customerType(customerType)
                .active(active == null || active)
                .build();
    }
}
