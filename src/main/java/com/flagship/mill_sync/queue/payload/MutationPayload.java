package com.flagship.mill_sync.queue.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.mill_sync.common.EntityRef;

import java.util.List;

/**
 * Typed snapshot carried by a mutation record.
 *
 * Each payload is serialized to JSON only when the record is stored, tagged
 * with its {@code kind}, so the queue itself never inspects entity schemas.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CustomerPayload.class, name = "customer"),
        @JsonSubTypes.Type(value = InventoryItemPayload.class, name = "inventory_item"),
        @JsonSubTypes.Type(value = StockMovementPayload.class, name = "stock_movement"),
        @JsonSubTypes.Type(value = TransactionPayload.class, name = "transaction"),
        @JsonSubTypes.Type(value = TransactionCancelPayload.class, name = "transaction_cancel"),
        @JsonSubTypes.Type(value = PaymentPayload.class, name = "payment"),
        @JsonSubTypes.Type(value = MillingPayload.class, name = "milling"),
        @JsonSubTypes.Type(value = DeletePayload.class, name = "delete")
})
public interface MutationPayload {

    /**
     * Other entities whose server ids must exist before this payload can be sent.
     */
    @JsonIgnore
    default List<EntityRef> references() {
        return List.of();
    }

    /**
     * Full-state snapshots can replace an unsent snapshot of the same entity.
     * Deltas such as stock movements never can.
     */
    @JsonIgnore
    default boolean isSnapshot() {
        return false;
    }
}
