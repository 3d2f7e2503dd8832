package com.flagship.mill_sync.customer;

import lombok.Builder;
import lombok.Value;

/**
 * Editable customer fields, as entered in the shell or received from the remote.
 */
@Value
@Builder
public class CustomerDetails {
    String name;
    String phone;
    String secondaryPhone;
    String address;
    String nicNumber;
    CustomerType customerType;
    @Builder.Default
    boolean active = true;
}
