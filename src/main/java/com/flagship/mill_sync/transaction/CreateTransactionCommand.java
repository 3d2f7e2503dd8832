package com.flagship.mill_sync.transaction;

import com.flagship.mill_sync.payment.PaymentMethod;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input of a buy or sell. Discount and paid amount default to zero.
 */
@Value
@Builder
public class CreateTransactionCommand {
    long customerId;
    @Singular
    List<LineItemCommand> lines;
    BigDecimal discount;
    BigDecimal paidAmount;
    PaymentMethod paymentMethod;
    String notes;
}
